package stenojava;

import java.util.*;

/**
 * Immutable mapping from chord key combinations to compiled patterns.
 *
 * <p>Tables are built once, by {@link #compileColumns(List)} and optional
 * {@link Builder} edits, and then shared read-only by every lookup.</p>
 *
 * <h3>Columns</h3>
 *
 * <p>A column is a set of keys on one side of a stenotype. A chord spans one or more
 * columns. Columns are given in physical order; the definition of column {@code N}
 * lists every chord whose rightmost key lies in column {@code N}. For example, with the
 * columns {@code S}, {@code TK}, {@code P} and {@code HR}:</p>
 *
 * <pre>
 * S=s
 * T=t K=k
 * P=p KP=g
 * H=h R=r PH=m SR=v
 * </pre>
 *
 * <p>Chords from different columns combine when their keys do not overlap; the
 * combined pattern separates the parts with {@link Pat#OPTIONAL_VOWELS}, so
 * {@code STR} becomes {@code seq('s', '!', 't', '!', 'r')}. {@code SR} overlaps the
 * {@code T} column and is never combined with {@code T}. When a key combination can be
 * composed in more than one way the one registered last wins: {@code KPH} is
 * {@code K|PH} rather than {@code KP|H}.</p>
 */
public final class ChordTable {

    private final Map<String, Pat> patterns;

    private ChordTable(Map<String, Pat> patterns) {
        this.patterns = Collections.unmodifiableMap(new LinkedHashMap<>(patterns));
    }

    /**
     * Compiles column definitions given in text form, one column per line, each line
     * holding whitespace-separated {@code chord=pattern} entries. Blank lines are ignored.
     *
     * @param lines the column lines, in physical order
     * @return the compiled table
     * @throws PatSyntaxException       if a pattern has unbalanced parentheses
     * @throws IllegalArgumentException if an entry is not of the form {@code chord=pattern}
     */
    public static ChordTable compileColumnLines(List<String> lines) {
        List<Map<String, String>> columns = new ArrayList<>();
        for (String line : lines) {
            String trimmed = line.trim();
            if (!trimmed.isEmpty()) columns.add(parseEntries(trimmed));
        }
        return compileColumns(columns);
    }

    /**
     * Parses whitespace-separated {@code key=value} entries, keeping their order.
     * Either side may be empty ({@code "="} maps the empty key to the empty value).
     *
     * @param text the entries
     * @return an ordered map of the entries
     * @throws IllegalArgumentException if an entry does not contain exactly one {@code =}
     */
    public static Map<String, String> parseEntries(String text) {
        Map<String, String> ret = new LinkedHashMap<>();
        for (String kv : text.trim().split("\\s+")) {
            if (kv.isEmpty()) continue;
            int eq = kv.indexOf('=');
            if (eq < 0 || kv.indexOf('=', eq + 1) >= 0) {
                throw new IllegalArgumentException("Malformed entry (expected key=value): " + kv);
            }
            ret.put(kv.substring(0, eq), kv.substring(eq + 1));
        }
        return ret;
    }

    /**
     * Combines column definitions into every reachable chord.
     *
     * <p>Each column maps chords to pattern strings. Columns are processed left to right.
     * Every chord of a column is registered on its own and, for every earlier group of
     * columns whose keys it does not touch, combined with each chord of that group as
     * {@code seq(earlier, '!', chord)}. Later registrations overwrite earlier ones. The
     * empty chord maps to the empty sequence.</p>
     *
     * @param columns the columns, in physical order
     * @return the compiled table
     * @throws PatSyntaxException if a pattern has unbalanced parentheses
     */
    public static ChordTable compileColumns(List<Map<String, String>> columns) {
        Map<Set<Character>, Map<String, Pat>> cumulative = new LinkedHashMap<>();
        for (Map<String, String> column : columns) {
            Map<String, Pat> chordToPat = new LinkedHashMap<>();
            for (Map.Entry<String, String> e : column.entrySet()) {
                String chord = e.getKey();
                Pat pat = PatCompiler.compile(e.getValue());
                chordToPat.put(chord, pat);
                Set<Character> keys = keysOf(chord);
                for (Map.Entry<Set<Character>, Map<String, Pat>> group : cumulative.entrySet()) {
                    if (!Collections.disjoint(keys, group.getKey())) continue;
                    for (Map.Entry<String, Pat> earlier : group.getValue().entrySet()) {
                        chordToPat.put(earlier.getKey() + chord,
                                Pat.seq(earlier.getValue(), Pat.lit(Pat.OPTIONAL_VOWELS), pat));
                    }
                }
            }
            Set<Character> covered = new HashSet<>();
            for (String chord : chordToPat.keySet()) {
                covered.addAll(keysOf(chord));
            }
            cumulative.put(covered, chordToPat);
        }

        Map<String, Pat> ret = new LinkedHashMap<>();
        ret.put("", Pat.seq());
        for (Map<String, Pat> group : cumulative.values()) {
            ret.putAll(group);
        }
        return new ChordTable(ret);
    }

    static Set<Character> keysOf(String chord) {
        Set<Character> keys = new HashSet<>();
        for (int i = 0; i < chord.length(); i++) {
            keys.add(chord.charAt(i));
        }
        return keys;
    }

    /**
     * Returns the pattern for a chord.
     *
     * @param chord the key combination, in canonical order
     * @return the pattern, or {@code null} if the chord is not in the table
     */
    public Pat get(String chord) {
        return patterns.get(chord);
    }

    /**
     * Returns whether the chord is in the table.
     *
     * @param chord the key combination
     * @return {@code true} if present
     */
    public boolean contains(String chord) {
        return patterns.containsKey(chord);
    }

    /**
     * Returns the number of chords.
     *
     * @return the size
     */
    public int size() {
        return patterns.size();
    }

    /**
     * Returns all chords and their patterns in registration order.
     *
     * @return an unmodifiable view
     */
    public Map<String, Pat> asMap() {
        return patterns;
    }

    /**
     * Returns a builder initialised with this table's entries.
     *
     * @return a new builder
     */
    public Builder toBuilder() {
        return new Builder(patterns);
    }

    @Override
    public String toString() {
        return "<ChordTable with " + patterns.size() + " chords>";
    }

    /**
     * Mutable staging area for deriving chords from a compiled table.
     */
    public static final class Builder {
        private final Map<String, Pat> patterns;

        private Builder(Map<String, Pat> patterns) {
            this.patterns = new LinkedHashMap<>(patterns);
        }

        /**
         * Returns the current pattern for a chord.
         *
         * @param chord the chord
         * @return the pattern
         * @throws IllegalArgumentException if the chord has not been registered
         */
        public Pat get(String chord) {
            Pat pat = patterns.get(chord);
            if (pat == null) {
                throw new IllegalArgumentException("Unknown chord: " + chord);
            }
            return pat;
        }

        /**
         * Registers or replaces a chord.
         *
         * @param chord the chord
         * @param pat   its pattern
         * @return {@code this}
         */
        public Builder put(String chord, Pat pat) {
            patterns.put(chord, Objects.requireNonNull(pat, "pat"));
            return this;
        }

        /**
         * Adds an alternative to an existing chord.
         *
         * @param chord       the chord
         * @param alternative the extra alternative, tried after the existing pattern
         * @return {@code this}
         */
        public Builder addAlternative(String chord, Pat alternative) {
            return put(chord, Pat.alt(get(chord), alternative));
        }

        /**
         * Returns a snapshot of the registered chords in registration order.
         *
         * @return an unmodifiable copy
         */
        public Map<String, Pat> snapshot() {
            return Collections.unmodifiableMap(new LinkedHashMap<>(patterns));
        }

        /**
         * Freezes the builder into a table.
         *
         * @return the table
         */
        public ChordTable build() {
            return new ChordTable(patterns);
        }
    }
}
