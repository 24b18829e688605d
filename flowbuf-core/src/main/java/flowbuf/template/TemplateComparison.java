package flowbuf.template;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Set comparison of the fields of two templates, ignoring order.
 */
public class TemplateComparison {

    public enum Result {
        EQUAL,
        /** Every field of the first template is in the second. */
        SUBSET,
        /** Every field of the second template is in the first. */
        SUPERSET,
        COMMON,
        DISJOINT,
    }

    public record Outcome(Result result, int matchingFields) {}

    private TemplateComparison() {
    }

    static Outcome compare(Template first, Template second, boolean ignoreLengths) {
        if (first == second) {
            return new Outcome(Result.EQUAL, first.size());
        }
        Comparator<TemplateField> cmp = Comparator.<TemplateField>comparingLong(f -> f.element().getEnterprise())
                                                  .thenComparingInt(f -> f.element().getId());
        if (! ignoreLengths) {
            cmp = cmp.thenComparingInt(TemplateField::length);
        }
        List<TemplateField> a = new ArrayList<>(first.getFields());
        List<TemplateField> b = new ArrayList<>(second.getFields());
        a.sort(cmp);
        b.sort(cmp);
        boolean firstIsShorter = a.size() <= b.size();
        List<TemplateField> shorter = firstIsShorter ? a : b;
        List<TemplateField> longer = firstIsShorter ? b : a;
        int matches = 0;
        int k = 0;
        for (TemplateField f0: shorter) {
            while (k < longer.size()) {
                int c = cmp.compare(f0, longer.get(k));
                if (c < 0) {
                    break;
                }
                k++;
                if (c == 0) {
                    matches++;
                    break;
                }
            }
        }
        Result result;
        if (matches != shorter.size()) {
            result = matches == 0 ? Result.DISJOINT : Result.COMMON;
        } else if (a.size() == b.size()) {
            result = Result.EQUAL;
        } else if (firstIsShorter) {
            result = Result.SUBSET;
        } else {
            result = Result.SUPERSET;
        }
        return new Outcome(result, matches);
    }
}
