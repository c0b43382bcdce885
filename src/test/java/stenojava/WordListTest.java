package stenojava;

import org.junit.jupiter.api.Test;

import java.io.BufferedReader;
import java.io.StringReader;
import java.io.UncheckedIOException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WordListTest {

    @Test
    void shouldSortAndDeduplicate() {
        WordList words = WordList.of("b", "a", "ab", "a");

        assertThat(words.size()).isEqualTo(3);
        assertThat(words.subList(0, words.size())).containsExactly("a", "ab", "b");
    }

    @Test
    void shouldRejectNonLowercaseWords() {
        assertThatThrownBy(() -> WordList.of("Hello"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void readerSkipsEntriesThatAreNotPlainWords() throws Exception {
        String text = "\uFEFFzebra\n  apple \nO'Neil\ncan't\n\nAlice\nmango\n";

        WordList words = WordList.fromReader(new BufferedReader(new StringReader(text)));

        assertThat(words.subList(0, words.size())).containsExactly("apple", "mango", "zebra");
    }

    @Test
    void lowerBoundIsRestrictedToRange() {
        WordList words = WordList.of("a", "ab", "ac", "ad", "b");

        assertThat(words.lowerBound("ab", 0, 5)).isEqualTo(1);
        assertThat(words.lowerBound("ae", 0, 5)).isEqualTo(4);
        assertThat(words.lowerBound("a", 2, 4)).isEqualTo(2);
        assertThat(words.lowerBound("z", 0, 3)).isEqualTo(3);
    }

    @Test
    void shouldLoadFromClasspath() {
        WordList words = WordList.fromResource("/dicts/test-words.txt");

        assertThat(words.contains("hello")).isTrue();
        assertThat(words.contains("Hello")).isFalse();
    }

    @Test
    void missingResourceIsUncheckedIoError() {
        assertThatThrownBy(() -> WordList.fromResource("/dicts/missing.txt"))
                .isInstanceOf(UncheckedIOException.class)
                .hasMessageContaining("/dicts/missing.txt");
    }
}
