package com.depintel.core.util;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Version constraint covering the common npm, PyPI and Maven notations.
 *
 * <p>Supported forms:
 * <ul>
 *   <li>{@code *}, {@code x}, {@code latest} or empty: any version</li>
 *   <li>exact versions: {@code 1.2.3}, {@code =1.2.3}, {@code ==1.2.3}</li>
 *   <li>comparators: {@code >1.0}, {@code >=1.0}, {@code <2}, {@code <=2.1}, {@code !=1.4.0}</li>
 *   <li>caret and tilde ranges: {@code ^1.2.3}, {@code ~1.2.3}, PyPI {@code ~=1.4}</li>
 *   <li>wildcards: {@code 1.x}, {@code 1.2.*}, {@code ==1.2.*}, partial versions such as {@code 1.2}</li>
 *   <li>hyphen ranges: {@code 1.0.0 - 2.0.0}</li>
 *   <li>conjunctions separated by commas or spaces, disjunctions separated by {@code ||}</li>
 * </ul>
 *
 * <p>Constraints that cannot be parsed are kept as {@link #isUnparseable() unparseable}; they
 * accept no version.
 */
public final class VersionConstraint {

    private static final Pattern TERM = Pattern.compile("^(\\^|~=|~|>=|<=|>|<|==|!=|=)?\\s*(.*)$");
    private static final Pattern PARTIAL = Pattern.compile(
        "^[vV]?(\\d+|[xX*])(?:\\.(\\d+|[xX*]))?(?:\\.(\\d+|[xX*]))?(.*)$");

    private final String text;
    private final List<List<Bound>> alternatives;
    private final List<SemanticVersion> referenced;
    private final boolean unparseable;

    private VersionConstraint(String text, List<List<Bound>> alternatives,
                              List<SemanticVersion> referenced, boolean unparseable) {
        this.text = text;
        this.alternatives = alternatives;
        this.referenced = referenced;
        this.unparseable = unparseable;
    }

    /**
     * Parses a constraint.
     *
     * @param text constraint text, {@code null} meaning any version
     * @return parsed constraint (never null)
     */
    public static VersionConstraint parse(String text) {
        String source = text == null ? "" : text.trim();
        List<List<Bound>> alternatives = new ArrayList<>();
        TreeSet<SemanticVersion> referenced = new TreeSet<>();
        try {
            for (String alternative : source.split("\\|\\|")) {
                alternatives.add(parseConjunction(alternative.trim(), referenced));
            }
        } catch (IllegalArgumentException e) {
            return new VersionConstraint(source, List.of(), List.of(), true);
        }
        return new VersionConstraint(source, List.copyOf(alternatives), List.copyOf(referenced), false);
    }

    /**
     * Checks whether a version satisfies the constraint.
     *
     * @param version candidate version
     * @return true when any alternative accepts the version
     */
    public boolean isSatisfiedBy(SemanticVersion version) {
        Objects.requireNonNull(version, "version must not be null");
        for (List<Bound> conjunction : alternatives) {
            if (conjunction.stream().allMatch(bound -> bound.accepts(version))) {
                return true;
            }
        }
        return false;
    }

    /**
     * Checks a version string; unparseable versions satisfy nothing.
     *
     * @param version candidate version text
     * @return true when the version parses and satisfies the constraint
     */
    public boolean isSatisfiedBy(String version) {
        return SemanticVersion.parse(version).map(this::isSatisfiedBy).orElse(false);
    }

    /**
     * Returns the concrete versions written in the constraint, ascending.
     *
     * <p>For {@code ^1.2.0 || 2.1.0} that is {@code [1.2.0, 2.1.0]}. Wildcard positions are zero.
     *
     * @return referenced versions
     */
    public List<SemanticVersion> referencedVersions() {
        return referenced;
    }

    /**
     * @return lowest referenced version, empty for "any version" constraints
     */
    public Optional<SemanticVersion> lowestReferenced() {
        return referenced.isEmpty() ? Optional.empty() : Optional.of(referenced.get(0));
    }

    public boolean isUnparseable() {
        return unparseable;
    }

    public boolean acceptsAny() {
        return !unparseable && alternatives.stream().anyMatch(List::isEmpty);
    }

    public String text() {
        return text;
    }

    @Override
    public String toString() {
        return text.isEmpty() ? "*" : text;
    }

    @Override
    public boolean equals(Object other) {
        return other instanceof VersionConstraint that && text.equals(that.text);
    }

    @Override
    public int hashCode() {
        return text.hashCode();
    }

    private static List<Bound> parseConjunction(String text, TreeSet<SemanticVersion> referenced) {
        if (text.isEmpty() || text.equals("*") || text.equalsIgnoreCase("x") || text.equalsIgnoreCase("latest")) {
            return List.of();
        }
        int hyphen = text.indexOf(" - ");
        if (hyphen > 0) {
            Partial low = Partial.parse(text.substring(0, hyphen).trim());
            Partial high = Partial.parse(text.substring(hyphen + 3).trim());
            referenced.add(low.floor());
            referenced.add(high.floor());
            List<Bound> bounds = new ArrayList<>();
            bounds.add(new Bound(Op.GTE, low.floor()));
            bounds.add(high.isComplete() ? new Bound(Op.LTE, high.floor()) : new Bound(Op.LT, high.ceiling()));
            return List.copyOf(bounds);
        }
        // "> = 1.0" and ">= 1.0" are both seen in manifests; glue operators to their operand.
        String normalized = text.replaceAll("([<>=!~^]+)\\s+", "$1");
        List<Bound> bounds = new ArrayList<>();
        for (String term : normalized.split("[,\\s]+")) {
            if (!term.isEmpty()) {
                bounds.addAll(parseTerm(term, referenced));
            }
        }
        return List.copyOf(bounds);
    }

    private static List<Bound> parseTerm(String term, TreeSet<SemanticVersion> referenced) {
        Matcher matcher = TERM.matcher(term);
        if (!matcher.matches()) {
            throw new IllegalArgumentException("Unsupported constraint term: " + term);
        }
        String operator = matcher.group(1) == null ? "" : matcher.group(1);
        String operand = matcher.group(2);
        if (operand.equals("*") || operand.equalsIgnoreCase("x")) {
            return List.of();
        }
        Partial partial = Partial.parse(operand);
        SemanticVersion floor = partial.floor();
        referenced.add(floor);
        return switch (operator) {
            case "^" -> List.of(new Bound(Op.GTE, floor), new Bound(Op.LT, caretCeiling(partial)));
            case "~" -> List.of(new Bound(Op.GTE, floor), new Bound(Op.LT, partial.components() == 1
                ? floor.nextMajor() : floor.nextMinor()));
            case "~=" -> List.of(new Bound(Op.GTE, floor), new Bound(Op.LT, partial.components() <= 2
                ? floor.nextMajor() : floor.nextMinor()));
            case ">" -> List.of(new Bound(partial.isComplete() ? Op.GT : Op.GTE,
                partial.isComplete() ? floor : partial.ceiling()));
            case ">=" -> List.of(new Bound(Op.GTE, floor));
            case "<" -> List.of(new Bound(Op.LT, floor));
            case "<=" -> List.of(partial.isComplete() ? new Bound(Op.LTE, floor) : new Bound(Op.LT, partial.ceiling()));
            case "!=" -> partial.isComplete()
                ? List.of(new Bound(Op.NEQ, floor))
                : List.of(new Bound(Op.OUTSIDE, floor, partial.ceiling()));
            default -> partial.isComplete()
                ? List.of(new Bound(Op.EQ, floor))
                : List.of(new Bound(Op.GTE, floor), new Bound(Op.LT, partial.ceiling()));
        };
    }

    private static SemanticVersion caretCeiling(Partial partial) {
        SemanticVersion floor = partial.floor();
        if (floor.major() > 0 || partial.components() == 1) {
            return floor.nextMajor();
        }
        if (floor.minor() > 0 || partial.components() == 2) {
            return floor.nextMinor();
        }
        return floor.nextPatch();
    }

    private enum Op { EQ, NEQ, GT, GTE, LT, LTE, OUTSIDE }

    private record Bound(Op op, SemanticVersion version, SemanticVersion upper) {

        Bound(Op op, SemanticVersion version) {
            this(op, version, null);
        }

        boolean accepts(SemanticVersion candidate) {
            int cmp = candidate.compareTo(version);
            return switch (op) {
                case EQ -> cmp == 0;
                case NEQ -> cmp != 0;
                case GT -> cmp > 0;
                case GTE -> cmp >= 0;
                case LT -> cmp < 0;
                case LTE -> cmp <= 0;
                case OUTSIDE -> cmp < 0 || candidate.compareTo(upper) >= 0;
            };
        }
    }

    /**
     * A version written with 1 to 3 components, any of which may be a wildcard.
     */
    private record Partial(int[] numbers, int components, String qualifier) {

        static Partial parse(String text) {
            Matcher matcher = PARTIAL.matcher(text);
            if (!matcher.matches()) {
                throw new IllegalArgumentException("Not a version: " + text);
            }
            int[] numbers = new int[3];
            int components = 0;
            for (int i = 0; i < 3; i++) {
                String group = matcher.group(i + 1);
                if (group == null || group.equalsIgnoreCase("x") || group.equals("*")) {
                    break;
                }
                numbers[i] = Integer.parseInt(group);
                components++;
            }
            String rest = matcher.group(4);
            if (components == 0) {
                throw new IllegalArgumentException("Not a version: " + text);
            }
            String qualifier = "";
            if (components == 3 && rest != null && !rest.isEmpty()) {
                qualifier = SemanticVersion.parse(text).map(SemanticVersion::preRelease).orElse("");
            }
            return new Partial(numbers, components, qualifier);
        }

        boolean isComplete() {
            return components == 3;
        }

        SemanticVersion floor() {
            return new SemanticVersion(numbers[0], numbers[1], numbers[2], qualifier);
        }

        // First version past the wildcard range: 1.2 -> 1.3.0, 1 -> 2.0.0.
        SemanticVersion ceiling() {
            SemanticVersion floor = floor();
            return switch (components) {
                case 1 -> floor.nextMajor();
                case 2 -> floor.nextMinor();
                default -> floor.nextPatch();
            };
        }
    }
}
