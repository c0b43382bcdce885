package stenojava;

import java.util.*;

/**
 * Resolves the vowel keys of a stroke into the vowel letters they may spell.
 *
 * <p>Rules, for a middle chord over {@code AOEU}:</p>
 * <ul>
 *   <li>{@code AOEU} spells {@code oo};</li>
 *   <li>three keys spell one of the two clusters associated with the key left out;</li>
 *   <li>{@code OE} spells {@code u} or {@code oe};</li>
 *   <li>anything else spells the keys themselves, with {@code U} read as {@code i}.</li>
 * </ul>
 *
 * <p>Patterns for all sixteen middle chords are compiled up front; see
 * {@link #compile(List)} for how clusters become patterns.</p>
 */
public final class VowelClusters {
    /**
     * Vowel keys in steno order.
     */
    public static final String KEYS = "AOEU";

    private final Map<Character, List<String>> threeVowels;
    private final Map<String, List<String>> clusters = new HashMap<>();
    private final Map<String, Pat> patterns = new HashMap<>();

    /**
     * @param threeVowels for each vowel key, the clusters spelled by the other three keys
     * @throws IllegalArgumentException if a vowel key has no entry
     */
    public VowelClusters(Map<Character, List<String>> threeVowels) {
        Map<Character, List<String>> copy = new HashMap<>();
        for (char key : KEYS.toCharArray()) {
            List<String> vcs = threeVowels.get(key);
            if (vcs == null || vcs.isEmpty()) {
                throw new IllegalArgumentException("No three-vowel clusters for missing key " + key);
            }
            copy.put(key, Collections.unmodifiableList(new ArrayList<>(vcs)));
        }
        this.threeVowels = Collections.unmodifiableMap(copy);

        for (int mask = 0; mask < 16; mask++) {
            StringBuilder middle = new StringBuilder();
            for (int i = 0; i < KEYS.length(); i++) {
                if ((mask & (1 << i)) != 0) middle.append(KEYS.charAt(i));
            }
            String m = middle.toString();
            List<String> vcs = Collections.unmodifiableList(resolve(m));
            clusters.put(m, vcs);
            patterns.put(m, compile(vcs));
        }
    }

    private List<String> resolve(String middle) {
        if (middle.equals(KEYS)) {
            return Collections.singletonList("oo");
        }
        if (middle.length() == 3) {
            for (char key : KEYS.toCharArray()) {
                if (middle.indexOf(key) < 0) return threeVowels.get(key);
            }
        }
        if (middle.equals("OE")) {
            return Arrays.asList("u", "oe");
        }
        return Collections.singletonList(middle.replace('U', 'i').toLowerCase(Locale.ROOT));
    }

    /**
     * Returns the vowel clusters a middle chord may spell.
     *
     * @param middle the vowel keys in steno order, possibly empty
     * @return the clusters; {@code [""]} for the empty chord
     * @throws IllegalArgumentException if {@code middle} is not a canonical vowel chord
     */
    public List<String> clustersFor(String middle) {
        List<String> vcs = clusters.get(middle);
        if (vcs == null) throw new IllegalArgumentException("Not a vowel chord: " + middle);
        return vcs;
    }

    /**
     * Returns the compiled pattern for a middle chord.
     *
     * @param middle the vowel keys in steno order, possibly empty
     * @return the pattern
     * @throws IllegalArgumentException if {@code middle} is not a canonical vowel chord
     */
    public Pat patternFor(String middle) {
        Pat pat = patterns.get(middle);
        if (pat == null) throw new IllegalArgumentException("Not a vowel chord: " + middle);
        return pat;
    }

    /**
     * Returns whether a string is a canonical vowel chord (including the empty chord).
     *
     * @param middle the candidate
     * @return {@code true} if it is one of the sixteen chords
     */
    public boolean isVowelChord(String middle) {
        return clusters.containsKey(middle);
    }

    /**
     * Compiles vowel letters into a pattern. Every {@code i} may also be {@code y}; every
     * {@code u} other than the first letter may also be {@code w}.
     *
     * @param vowels the letters
     * @return the pattern, e.g. {@code seq(alt('i', 'y'), alt('u', 'w'))} for {@code "iu"}
     */
    public static Pat vowelsToPat(String vowels) {
        List<Pat> parts = new ArrayList<>(vowels.length());
        for (int i = 0; i < vowels.length(); i++) {
            char c = vowels.charAt(i);
            if (c == 'i') {
                parts.add(Pat.alt(Pat.lit('i'), Pat.lit('y')));
            } else if (c == 'u' && i > 0) {
                parts.add(Pat.alt(Pat.lit('u'), Pat.lit('w')));
            } else {
                parts.add(Pat.lit(c));
            }
        }
        return Pat.seq(parts);
    }

    /**
     * Compiles clusters into one pattern matching any of them.
     *
     * <p>A two-letter cluster matches its letters in either order, followed by an optional
     * {@link Pat#OPTIONAL_SEMIVOWEL}. Shorter clusters compile with {@link #vowelsToPat(String)}.</p>
     *
     * @param vcs the clusters
     * @return the pattern
     */
    public static Pat compile(List<String> vcs) {
        List<Pat> choices = new ArrayList<>(vcs.size());
        for (String vc : vcs) {
            if (vc.length() == 2) {
                Pat choice = vc.charAt(0) == vc.charAt(1)
                        ? vowelsToPat(vc)
                        : Pat.alt(vowelsToPat(vc), vowelsToPat(new StringBuilder(vc).reverse().toString()));
                choices.add(Pat.seq(choice, Pat.alt(Pat.seq(), Pat.lit(Pat.OPTIONAL_SEMIVOWEL))));
            } else {
                choices.add(vowelsToPat(vc));
            }
        }
        return Pat.alt(choices);
    }
}
