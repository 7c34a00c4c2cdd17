package com.krickert.hacluster.config.cib;

import com.krickert.hacluster.config.cib.model.CibElement;
import com.krickert.hacluster.config.report.ReportItem;
import com.krickert.hacluster.config.report.ReportItems;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Helpers over the CIB tree shared by the constraint and resource set code.
 */
public final class CibTools {

    public static final String CONSTRAINTS_SECTION = "constraints";

    private CibTools() {
    }

    /**
     * Returns the proposed id if no element in the tree uses it, otherwise the first free
     * {@code proposed-N} for N = 1, 2, ...
     */
    public static String findUniqueId(CibElement tree, String proposedId) {
        String candidate = proposedId;
        int counter = 1;
        while (tree.idExists(candidate)) {
            candidate = proposedId + "-" + counter;
            counter++;
        }
        return candidate;
    }

    public static Map<String, String> exportAttributes(CibElement element) {
        return new LinkedHashMap<>(element.getAttributes());
    }

    public static Optional<CibElement> getConstraints(CibElement tree) {
        CibElement root = tree.getRoot();
        if (CONSTRAINTS_SECTION.equals(root.getTag())) {
            return Optional.of(root);
        }
        return root.findFirstDescendant(CONSTRAINTS_SECTION);
    }

    /**
     * Checks the id is a valid XML id: a letter or underscore followed by letters, digits,
     * underscores, dots and dashes. Only the first offending character is reported.
     *
     * @param description what the id identifies, used in reports
     */
    public static List<ReportItem> validateId(String id, String description) {
        if (id == null || id.isEmpty()) {
            return List.of(ReportItems.emptyId(description));
        }
        char first = id.charAt(0);
        if (!isAsciiLetter(first) && first != '_') {
            return List.of(ReportItems.invalidId(id, description, first, true));
        }
        for (int i = 1; i < id.length(); i++) {
            char character = id.charAt(i);
            if (!isAsciiLetter(character) && !isAsciiDigit(character)
                    && character != '_' && character != '.' && character != '-') {
                return List.of(ReportItems.invalidId(id, description, character, false));
            }
        }
        return List.of();
    }

    /**
     * {@link #validateId} plus a check the id is not used in the tree yet.
     */
    public static List<ReportItem> validateNewId(CibElement tree, String id, String description) {
        List<ReportItem> reports = new ArrayList<>(validateId(id, description));
        if (reports.isEmpty() && tree.idExists(id)) {
            reports.add(ReportItems.idAlreadyExists(id));
        }
        return reports;
    }

    private static boolean isAsciiLetter(char character) {
        return (character >= 'a' && character <= 'z') || (character >= 'A' && character <= 'Z');
    }

    private static boolean isAsciiDigit(char character) {
        return character >= '0' && character <= '9';
    }
}
