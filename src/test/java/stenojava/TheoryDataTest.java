package stenojava;

import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TheoryDataTest {

    @Test
    void shouldLoadBundledTheory() throws IOException {
        TheoryData data = TheoryData.loadDefault();

        assertThat(data.leftColumns).hasSize(5);
        assertThat(data.rightColumns).hasSize(6);
        assertThat(data.threeVowels).containsOnlyKeys("A", "O", "E", "U");
        assertThat(data.threeVowels.get("A")).containsExactly("ee", "ui");
        assertThat(data.briefs).containsEntry("W", "with").containsEntry("", "");
        assertThat(data.phraseGroups).hasSize(3);
        assertThat(data.phraseGroups.get(0).skipForRightBriefs).isTrue();
        assertThat(data.fragments).containsOnlyKeys("KWR", "KWR-R", "KWR-RS", "W");
    }

    @Test
    void writtenJsonReadsBack() throws IOException {
        TheoryData data = TheoryData.loadDefault();
        StringWriter out = new StringWriter();
        data.writeJson(out);

        TheoryData copy = TheoryData.fromJson(
                new ByteArrayInputStream(out.toString().getBytes(StandardCharsets.UTF_8)));

        assertThat(copy.leftColumns).isEqualTo(data.leftColumns);
        assertThat(copy.islands).isEqualTo(data.islands);
        assertThat(copy.phraseGroups.get(1).options).isEqualTo(data.phraseGroups.get(1).options);
    }

    @Test
    void shouldRejectUnknownProperties() {
        byte[] json = "{\"leftColumns\": [], \"rightHand\": []}".getBytes(StandardCharsets.UTF_8);

        assertThatThrownBy(() -> TheoryData.fromJson(new ByteArrayInputStream(json)))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("rightHand");
    }
}
