package com.depintel.core.util;

import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Static license knowledge: alias normalization, category classification and the
 * dependency-to-target compatibility matrix.
 *
 * <p>Compatibility is decided per category pair, with pairwise exceptions for licenses whose
 * relationship differs from their categories (GPL-2.0-only against GPL-3.0 or Apache-2.0, for
 * instance). SPDX expressions are honoured: {@code A OR B} takes the better outcome,
 * {@code A AND B} the worse.
 */
public final class LicenseCatalog {

    private static final String PROPRIETARY_ID = "LicenseRef-Proprietary";

    private static final Map<String, String> ALIASES = new HashMap<>();
    private static final Map<String, LicenseCategory> CATEGORIES = new HashMap<>();
    private static final Map<LicenseCategory, Map<LicenseCategory, Compatibility>> MATRIX =
        new EnumMap<>(LicenseCategory.class);
    private static final Map<String, Compatibility> PAIR_EXCEPTIONS = new HashMap<>();

    static {
        register(LicenseCategory.PERMISSIVE, "MIT", "mit", "expat", "mit license", "the mit license");
        register(LicenseCategory.PERMISSIVE, "Apache-2.0", "apache-2.0", "apache2", "apache 2", "apache 2.0",
            "apache-2", "apache license 2.0", "apache license, version 2.0", "apache software license",
            "apache", "asl 2.0");
        register(LicenseCategory.PERMISSIVE, "BSD-2-Clause", "bsd-2-clause", "simplified bsd", "freebsd");
        register(LicenseCategory.PERMISSIVE, "BSD-3-Clause", "bsd-3-clause", "bsd", "new bsd", "modified bsd",
            "bsd license");
        register(LicenseCategory.PERMISSIVE, "ISC", "isc", "isc license");
        register(LicenseCategory.PERMISSIVE, "Zlib", "zlib");
        register(LicenseCategory.PERMISSIVE, "Python-2.0", "python-2.0", "psf", "psfl", "psf-2.0");
        register(LicenseCategory.PERMISSIVE, "BSL-1.0", "bsl-1.0", "boost");
        register(LicenseCategory.PUBLIC_DOMAIN, "CC0-1.0", "cc0-1.0", "cc0", "public domain", "public-domain");
        register(LicenseCategory.PUBLIC_DOMAIN, "Unlicense", "unlicense", "the unlicense");
        register(LicenseCategory.PUBLIC_DOMAIN, "0BSD", "0bsd");
        register(LicenseCategory.PUBLIC_DOMAIN, "WTFPL", "wtfpl");
        register(LicenseCategory.WEAK_COPYLEFT, "LGPL-2.1-only", "lgpl-2.1", "lgpl-2.1-only", "lgplv2.1", "lgpl2.1");
        register(LicenseCategory.WEAK_COPYLEFT, "LGPL-2.1-or-later", "lgpl-2.1-or-later", "lgpl-2.1+");
        register(LicenseCategory.WEAK_COPYLEFT, "LGPL-3.0-only", "lgpl-3.0", "lgpl-3.0-only", "lgplv3", "lgpl3");
        register(LicenseCategory.WEAK_COPYLEFT, "LGPL-3.0-or-later", "lgpl-3.0-or-later", "lgpl-3.0+", "lgpl");
        register(LicenseCategory.WEAK_COPYLEFT, "MPL-2.0", "mpl-2.0", "mpl2", "mpl 2.0", "mozilla public license 2.0");
        register(LicenseCategory.WEAK_COPYLEFT, "EPL-1.0", "epl-1.0");
        register(LicenseCategory.WEAK_COPYLEFT, "EPL-2.0", "epl-2.0", "epl", "eclipse public license 2.0");
        register(LicenseCategory.WEAK_COPYLEFT, "CDDL-1.0", "cddl-1.0", "cddl");
        register(LicenseCategory.STRONG_COPYLEFT, "GPL-2.0-only", "gpl-2.0", "gpl-2.0-only", "gplv2", "gpl2");
        register(LicenseCategory.STRONG_COPYLEFT, "GPL-2.0-or-later", "gpl-2.0-or-later", "gpl-2.0+");
        register(LicenseCategory.STRONG_COPYLEFT, "GPL-3.0-only", "gpl-3.0", "gpl-3.0-only", "gplv3", "gpl3");
        register(LicenseCategory.STRONG_COPYLEFT, "GPL-3.0-or-later", "gpl-3.0-or-later", "gpl-3.0+", "gpl");
        register(LicenseCategory.STRONG_COPYLEFT, "AGPL-3.0-only", "agpl-3.0", "agpl-3.0-only", "agplv3", "agpl");
        register(LicenseCategory.STRONG_COPYLEFT, "AGPL-3.0-or-later", "agpl-3.0-or-later", "agpl-3.0+");
        register(LicenseCategory.PROPRIETARY, PROPRIETARY_ID, "proprietary", "commercial",
            "all rights reserved", "licenseref-proprietary", "unlicensed");

        Compatibility c = Compatibility.COMPATIBLE;
        Compatibility w = Compatibility.CONDITIONAL;
        Compatibility x = Compatibility.INCOMPATIBLE;
        // Rows: license of the dependency. Columns: category of the target license.
        row(LicenseCategory.PERMISSIVE,      c, c, c, c, c);
        row(LicenseCategory.PUBLIC_DOMAIN,   c, c, c, c, c);
        row(LicenseCategory.WEAK_COPYLEFT,   w, w, w, c, w);
        row(LicenseCategory.STRONG_COPYLEFT, x, x, x, w, x);
        row(LicenseCategory.PROPRIETARY,     x, x, x, x, w);

        exception("Apache-2.0", "GPL-2.0-only", x);
        exception("GPL-2.0-only", "GPL-3.0-only", x);
        exception("GPL-2.0-only", "GPL-3.0-or-later", x);
        exception("GPL-2.0-only", "AGPL-3.0-only", x);
        exception("GPL-2.0-only", "AGPL-3.0-or-later", x);
        exception("GPL-3.0-only", "GPL-2.0-only", x);
        exception("GPL-3.0-or-later", "GPL-2.0-only", x);
        exception("LGPL-3.0-only", "GPL-2.0-only", x);
        exception("LGPL-3.0-or-later", "GPL-2.0-only", x);
        exception("EPL-1.0", "GPL-2.0-only", x);
        exception("EPL-1.0", "GPL-3.0-only", x);
        exception("GPL-2.0-or-later", "GPL-3.0-only", c);
        exception("GPL-2.0-or-later", "GPL-3.0-or-later", c);
        exception("GPL-3.0-only", "AGPL-3.0-only", c);
        exception("GPL-3.0-or-later", "AGPL-3.0-only", c);
        exception("GPL-3.0-or-later", "GPL-3.0-only", c);
        exception("GPL-3.0-only", "GPL-3.0-or-later", c);
    }

    private LicenseCatalog() {
        // Utility class
    }

    /**
     * Normalizes a license identifier or alias to its SPDX id.
     *
     * @param license raw identifier
     * @return SPDX id, the trimmed input when unrecognized, empty for blank input
     */
    public static Optional<String> normalize(String license) {
        if (license == null || license.isBlank()) {
            return Optional.empty();
        }
        String trimmed = license.trim();
        String key = trimmed.toLowerCase(Locale.ROOT).replace('_', '-');
        String canonical = ALIASES.get(key);
        if (canonical == null && key.endsWith(" license")) {
            canonical = ALIASES.get(key.substring(0, key.length() - " license".length()));
        }
        return Optional.of(canonical != null ? canonical : trimmed);
    }

    /**
     * Classifies a single license.
     *
     * @param license raw identifier or alias
     * @return category, {@link LicenseCategory#UNKNOWN} when unrecognized
     */
    public static LicenseCategory classify(String license) {
        return normalize(license)
            .map(id -> CATEGORIES.getOrDefault(id, LicenseCategory.UNKNOWN))
            .orElse(LicenseCategory.UNKNOWN);
    }

    /**
     * Whether the identifier is recognized.
     *
     * @param license raw identifier
     * @return true when it normalizes to a known license
     */
    public static boolean isKnown(String license) {
        return classify(license) != LicenseCategory.UNKNOWN;
    }

    /**
     * Decides whether code under {@code dependencyLicense} can be shipped in a project licensed
     * under {@code targetLicense}.
     *
     * @param dependencyLicense license of the dependency, possibly an SPDX expression
     * @param targetLicense license of the project
     * @return compatibility; {@link Compatibility#UNKNOWN} when the dependency license is unrecognized
     */
    public static Compatibility compatibility(String dependencyLicense, String targetLicense) {
        String expression = stripParentheses(dependencyLicense == null ? "" : dependencyLicense.trim());
        if (expression.contains(" OR ")) {
            return best(List.of(expression.split(" OR ")), targetLicense);
        }
        if (expression.contains(" AND ")) {
            return worst(List.of(expression.split(" AND ")), targetLicense);
        }
        return single(expression, targetLicense);
    }

    /**
     * Returns the least favourable compatibility across a list.
     *
     * @param licenses dependency licenses
     * @param targetLicense project license
     * @return worst compatibility, {@link Compatibility#UNKNOWN} for an empty list
     */
    public static Compatibility worst(List<String> licenses, String targetLicense) {
        if (licenses.isEmpty()) {
            return Compatibility.UNKNOWN;
        }
        Compatibility result = Compatibility.COMPATIBLE;
        for (String license : licenses) {
            Compatibility current = compatibility(license, targetLicense);
            if (current.severity() > result.severity()) {
                result = current;
            }
        }
        return result;
    }

    private static Compatibility best(List<String> licenses, String targetLicense) {
        Compatibility result = null;
        for (String license : licenses) {
            Compatibility current = compatibility(license, targetLicense);
            if (result == null || current.severity() < result.severity()) {
                result = current;
            }
        }
        return result == null ? Compatibility.UNKNOWN : result;
    }

    private static Compatibility single(String dependencyLicense, String targetLicense) {
        Optional<String> dependency = normalize(dependencyLicense);
        Optional<String> target = normalize(targetLicense);
        LicenseCategory dependencyCategory = classify(dependencyLicense);
        LicenseCategory targetCategory = classify(targetLicense);
        if (dependencyCategory == LicenseCategory.UNKNOWN || targetCategory == LicenseCategory.UNKNOWN) {
            return Compatibility.UNKNOWN;
        }
        String dependencyId = dependency.orElseThrow();
        String targetId = target.orElseThrow();
        Compatibility exception = PAIR_EXCEPTIONS.get(pairKey(dependencyId, targetId));
        if (exception != null) {
            return exception;
        }
        if (dependencyId.equals(targetId) && dependencyCategory != LicenseCategory.PROPRIETARY) {
            return Compatibility.COMPATIBLE;
        }
        return MATRIX.get(dependencyCategory).get(targetCategory);
    }

    private static String stripParentheses(String text) {
        return text.replace("(", "").replace(")", "").trim();
    }

    private static void register(LicenseCategory category, String id, String... aliases) {
        CATEGORIES.put(id, category);
        ALIASES.put(id.toLowerCase(Locale.ROOT), id);
        for (String alias : aliases) {
            ALIASES.put(alias, id);
        }
    }

    private static void row(LicenseCategory dependency, Compatibility permissive, Compatibility publicDomain,
                            Compatibility weak, Compatibility strong, Compatibility proprietary) {
        Map<LicenseCategory, Compatibility> row = new EnumMap<>(LicenseCategory.class);
        row.put(LicenseCategory.PERMISSIVE, permissive);
        row.put(LicenseCategory.PUBLIC_DOMAIN, publicDomain);
        row.put(LicenseCategory.WEAK_COPYLEFT, weak);
        row.put(LicenseCategory.STRONG_COPYLEFT, strong);
        row.put(LicenseCategory.PROPRIETARY, proprietary);
        MATRIX.put(dependency, row);
    }

    private static void exception(String dependency, String target, Compatibility compatibility) {
        PAIR_EXCEPTIONS.put(pairKey(dependency, target), compatibility);
    }

    private static String pairKey(String dependency, String target) {
        return dependency + "->" + target;
    }

    /**
     * License families.
     */
    public enum LicenseCategory {
        PERMISSIVE("permissive"),
        PUBLIC_DOMAIN("public-domain"),
        WEAK_COPYLEFT("weak-copyleft"),
        STRONG_COPYLEFT("copyleft"),
        PROPRIETARY("proprietary"),
        UNKNOWN("unknown");

        private final String label;

        LicenseCategory(String label) {
            this.label = label;
        }

        public String label() {
            return label;
        }
    }

    /**
     * Outcome of a compatibility check, ordered from best to worst.
     */
    public enum Compatibility {
        COMPATIBLE(0),
        CONDITIONAL(1),
        UNKNOWN(2),
        INCOMPATIBLE(3);

        private final int severity;

        Compatibility(int severity) {
            this.severity = severity;
        }

        public int severity() {
            return severity;
        }
    }
}
