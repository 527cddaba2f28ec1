package org.proofmin.proof;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Accumulatore delle dipendenze scoperte durante la valutazione di un singolo
 * candidato. Viene passato esplicitamente lungo la catena di chiamate: ogni
 * candidato ne usa un'istanza propria.
 */
public class ExtraDependencies {

    private static final Logger LOGGER = Logger.getLogger(ExtraDependencies.class.getName());

    private static final Pattern LEMMA_INDEX = Pattern.compile("(?:.*_)?lemma_(\\d+)$");

    private final List<NamedFormula> entries = new ArrayList<>();

    public void add(NamedFormula entry) {
        entries.add(entry);
    }

    public void add(String name, String formula) {
        add(new NamedFormula(name, formula));
    }

    public List<NamedFormula> entries() {
        return Collections.unmodifiableList(entries);
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public int size() {
        return entries.size();
    }

    /**
     * Indice più alto tra i nomi {@code ..._lemma_NNNN} presenti, 0 se nessuno.
     */
    public int lastLemmaIndex() {
        return lastLemmaIndex(entries);
    }

    static int lastLemmaIndex(List<NamedFormula> formulas) {
        int max = 0;
        for (NamedFormula f : formulas) {
            Matcher m = LEMMA_INDEX.matcher(f.name());
            if (m.matches()) {
                max = Math.max(max, Integer.parseInt(m.group(1)));
            }
        }
        return max;
    }

    /**
     * Aggiunge i passi estratti con i nomi globali assegnati dalla rinomina.
     */
    public void extend(Extraction extraction, Map<Integer, String> renaming) {
        extraction.proof().steps().forEach((index, step) -> {
            String name = renaming.get(index);
            if (name == null) {
                LOGGER.warning("Rinomina mancante per il passo " + index);
            } else {
                add(name, step.formula());
            }
        });
    }
}
