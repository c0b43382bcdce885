package stenojava;

import java.util.*;
import java.util.logging.Logger;

import static stenojava.Pat.alt;
import static stenojava.Pat.lit;
import static stenojava.Pat.seq;

/**
 * The compiled Right-E steno theory: chord tables for both hands, vowel cluster patterns,
 * islands and fragments.
 *
 * <p>Compilation happens once, in {@link #compile(TheoryData)}; the result is immutable
 * and may be shared by any number of concurrent lookups.</p>
 *
 * <p>On top of the column tables, the following chords are derived:</p>
 * <ul>
 *   <li>left {@code +} alone matches nothing (it is a continuation key);</li>
 *   <li>since {@code HR} is {@code l}, left chords ending in {@code WR} or {@code R} after
 *       {@code S}, {@code T}, {@code K}, {@code KP} or {@code TPKW} may also spell
 *       {@code h r};</li>
 *   <li>left {@code KPH} may also be {@code k n};</li>
 *   <li>right {@code F} and {@code R} combine with every other right chord (see
 *       {@link #deriveRightVariants(ChordTable)}), and {@code Z} alone is {@code z}.</li>
 * </ul>
 */
public final class RightETheory {
    private static final Logger LOGGER = Logger.getLogger(RightETheory.class.getName());

    private static final Pat GAP = lit(Pat.OPTIONAL_VOWELS);

    private final ChordTable left;
    private final ChordTable right;
    private final VowelClusters vowels;
    private final Map<String, String> islands;
    private final Map<String, String> fragments;

    private RightETheory(ChordTable left, ChordTable right, VowelClusters vowels,
                         Map<String, String> islands, Map<String, String> fragments) {
        this.left = left;
        this.right = right;
        this.vowels = vowels;
        this.islands = Collections.unmodifiableMap(new LinkedHashMap<>(islands));
        this.fragments = Collections.unmodifiableMap(new LinkedHashMap<>(fragments));
    }

    /**
     * Compiles theory data.
     *
     * @param data the raw tables
     * @return the compiled theory
     * @throws PatSyntaxException       if a column pattern has unbalanced parentheses
     * @throws IllegalArgumentException if the data is malformed
     */
    public static RightETheory compile(TheoryData data) {
        long t0 = System.nanoTime();

        ChordTable left = deriveLeftVariants(ChordTable.compileColumnLines(data.leftColumns));
        ChordTable right = deriveRightVariants(ChordTable.compileColumnLines(data.rightColumns));
        VowelClusters vowels = new VowelClusters(toKeyMap(data.threeVowels));
        Map<String, String> islands = buildIslands(data);

        long ms = (System.nanoTime() - t0) / 1_000_000;
        LOGGER.info("Compiled theory (" + ms + " ms): " + left.size() + " left chords, "
                + right.size() + " right chords, " + islands.size() + " islands");
        return new RightETheory(left, right, vowels, islands, data.fragments);
    }

    private static Map<Character, List<String>> toKeyMap(Map<String, List<String>> threeVowels) {
        Map<Character, List<String>> ret = new HashMap<>();
        for (Map.Entry<String, List<String>> e : threeVowels.entrySet()) {
            if (e.getKey().length() != 1) {
                throw new IllegalArgumentException("Three-vowel key must be a single vowel key: " + e.getKey());
            }
            ret.put(e.getKey().charAt(0), e.getValue());
        }
        return ret;
    }

    /**
     * Adds the derived left-hand chords to a compiled column table.
     *
     * @param columns the table compiled from the left columns
     * @return the table with derived chords
     */
    static ChordTable deriveLeftVariants(ChordTable columns) {
        ChordTable.Builder b = columns.toBuilder();
        b.put("+", seq());
        for (String x : Arrays.asList("S", "T")) {
            b.addAlternative(x + "WR", seq(b.get(x), GAP, lit('h'), lit('r')));
        }
        for (String x : Arrays.asList("K", "KP", "TPKW")) {
            b.addAlternative(x + "R", seq(b.get(x), GAP, lit('h'), lit('r')));
        }
        b.addAlternative("KPH", seq(b.get("K"), GAP, lit('n')));
        return b.build();
    }

    /**
     * Adds {@code F}, {@code R} and {@code FR} variants of every chord of a compiled
     * right-hand column table.
     *
     * <p>For a chord {@code c} with pattern {@code p}:</p>
     * <ul>
     *   <li>{@code F} is {@code f} or {@code v} ({@code v} first when {@code c} is {@code Z}),
     *       or {@code s} when {@code c} has any of {@code PBLGT};</li>
     *   <li>{@code R} is {@code r}, or {@code r} or {@code l} when {@code c} has {@code P} or
     *       {@code B};</li>
     *   <li>{@code FR} is F then R or R then F, or {@code m} unless the {@code PBLG} keys of
     *       {@code c} are exactly {@code PL} or {@code BG}, or {@code n} when they are exactly
     *       {@code BG};</li>
     *   <li>{@code Fc} is F then {@code p}; {@code Rc} is R then {@code p}, or {@code p} then
     *       {@code r}; {@code FRc} is FR then {@code p}, or F then {@code p} then {@code r}.</li>
     * </ul>
     *
     * @param columns the table compiled from the right columns
     * @return the table with derived chords
     */
    static ChordTable deriveRightVariants(ChordTable columns) {
        ChordTable.Builder b = columns.toBuilder();
        Set<Character> pl = ChordTable.keysOf("PL");
        Set<Character> bg = ChordTable.keysOf("BG");
        for (Map.Entry<String, Pat> e : columns.asMap().entrySet()) {
            String chord = e.getKey();
            Pat pat = e.getValue();
            Set<Character> pblg = ChordTable.keysOf(chord);
            pblg.retainAll(ChordTable.keysOf("PBLG"));

            boolean fPrioritizeV = chord.equals("Z");
            boolean fCanBeS = hasAny(chord, "PBLGT");
            boolean rCanBeL = hasAny(chord, "PB");
            boolean frCanBeM = !pblg.equals(pl) && !pblg.equals(bg);
            boolean frCanBeN = pblg.equals(bg);

            Pat fPat = fPrioritizeV ? alt(lit('v'), lit('f')) : alt(lit('f'), lit('v'));
            if (fCanBeS) fPat = alt(fPat, lit('s'));
            Pat rPat = rCanBeL ? alt(lit('r'), lit('l')) : lit('r');
            Pat frPat = alt(seq(fPat, GAP, rPat), seq(rPat, GAP, fPat));
            if (frCanBeM) frPat = alt(frPat, lit('m'));
            if (frCanBeN) frPat = alt(frPat, lit('n'));

            b.put("F" + chord, seq(fPat, GAP, pat));
            // R can come before or after the rest of the chord
            b.put("R" + chord, alt(seq(rPat, GAP, pat), seq(pat, GAP, lit('r'))));
            b.put("FR" + chord, alt(seq(frPat, GAP, pat), seq(fPat, GAP, pat, GAP, lit('r'))));
        }
        b.put("Z", lit('z'));
        return b.build();
    }

    private static boolean hasAny(String chord, String keys) {
        for (int i = 0; i < chord.length(); i++) {
            if (keys.indexOf(chord.charAt(i)) >= 0) return true;
        }
        return false;
    }

    /**
     * Expands briefs and phrase groups into islands, then adds the fixed islands.
     *
     * <p>Every brief {@code k -> w} yields {@code ^k -> w} and, for every way of picking at
     * most one option from each phrase group (at least one in total), the stroke
     * {@code k}, a hyphen unless {@code k} already has one, and the picked keys, mapped to
     * the words joined by spaces. {@code W-T} is therefore {@code with the}. Groups marked
     * {@code skipForRightBriefs} are not used with hyphenated briefs.</p>
     *
     * @param data the raw tables
     * @return the islands, fixed islands overriding generated ones
     */
    static Map<String, String> buildIslands(TheoryData data) {
        Map<String, String> islands = new LinkedHashMap<>();
        for (Map.Entry<String, String> brief : data.briefs.entrySet()) {
            String k = brief.getKey();
            String v = brief.getValue();
            islands.put("^" + k, v);
            boolean hasRight = k.contains("-");
            String hyphen = hasRight ? "" : "-";
            List<String[]> combos = new ArrayList<>();
            combos.add(new String[]{"", ""});
            for (TheoryData.PhraseGroup group : data.phraseGroups) {
                if (hasRight && group.skipForRightBriefs) continue;
                List<String[]> next = new ArrayList<>();
                for (String[] combo : combos) {
                    next.add(combo);
                    for (Map.Entry<String, String> option : group.options.entrySet()) {
                        next.add(new String[]{combo[0] + option.getKey(), join(combo[1], option.getValue())});
                    }
                }
                combos = next;
            }
            for (String[] combo : combos) {
                if (combo[0].isEmpty()) continue;
                islands.put(k + hyphen + combo[0], join(v, combo[1]));
            }
        }
        islands.putAll(data.islands);
        return islands;
    }

    private static String join(String a, String b) {
        if (a.isEmpty()) return b;
        if (b.isEmpty()) return a;
        return a + " " + b;
    }

    // ---- accessors ----------------------------------------------------------

    public ChordTable left() {
        return left;
    }

    public ChordTable right() {
        return right;
    }

    public VowelClusters vowels() {
        return vowels;
    }

    /**
     * Returns the island for a stroke.
     *
     * @param stroke the stroke
     * @return the fixed output, or {@code null} if the stroke is not an island
     */
    public String island(String stroke) {
        return islands.get(stroke);
    }

    /**
     * Returns whether a stroke is a fragment.
     *
     * @param stroke the stroke
     * @return {@code true} if the stroke is consumed silently inside outlines
     */
    public boolean isFragment(String stroke) {
        return fragments.containsKey(stroke);
    }

    public Map<String, String> islands() {
        return islands;
    }

    public Map<String, String> fragments() {
        return fragments;
    }

    @Override
    public String toString() {
        return "<RightETheory with " + left.size() + " left chords, " + right.size()
                + " right chords, " + islands.size() + " islands>";
    }
}
