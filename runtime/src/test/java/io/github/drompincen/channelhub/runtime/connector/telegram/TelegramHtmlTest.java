package io.github.drompincen.channelhub.runtime.connector.telegram;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class TelegramHtmlTest {

    @Test
    void markdownBecomesTelegramTags() {
        assertThat(TelegramHtml.toHtml("**bold** and `code` and ~~gone~~"))
                .isEqualTo("<b>bold</b> and <code>code</code> and <s>gone</s>");
    }

    @Test
    void codeBlocksBecomePre() {
        assertThat(TelegramHtml.toHtml("```java\nint x;\n```")).isEqualTo("<pre>int x;\n</pre>");
    }

    @Test
    void specialCharactersAreEscaped() {
        assertThat(TelegramHtml.toHtml("a < b & c > d")).isEqualTo("a &lt; b &amp; c &gt; d");
    }

    @Test
    void allowedTagsSurviveOthersAreEscaped() {
        assertThat(TelegramHtml.toHtml("<b>kept</b><script>x</script>"))
                .isEqualTo("<b>kept</b>&lt;script&gt;x&lt;/script&gt;");
    }

    @Test
    void snakeCaseIsNotItalicised() {
        assertThat(TelegramHtml.toHtml("use my_var_name here")).isEqualTo("use my_var_name here");
    }

    @Test
    void stripTagsProducesPlainText() {
        assertThat(TelegramHtml.stripTags("<b>x</b> &lt;y&gt; &amp; z")).isEqualTo("x <y> & z");
    }
}
