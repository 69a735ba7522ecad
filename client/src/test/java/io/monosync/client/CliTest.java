// file: client/src/test/java/io/monosync/client/CliTest.java
package io.monosync.client;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CliTest {

    @Test
    void base_url_flag_is_split_off_the_command() {
        Map.Entry<String, String[]> parsed = Cli.parseBaseUrl(
                new String[]{"--base-url", "http://h:9", "check", "large"});
        assertEquals("http://h:9", parsed.getKey());
        assertArrayEquals(new String[]{"check", "large"}, parsed.getValue());
    }

    @Test
    void default_base_url_when_flag_absent() {
        Map.Entry<String, String[]> parsed = Cli.parseBaseUrl(new String[]{"bookmarks", "small"});
        assertEquals("http://localhost:8080", parsed.getKey());
        assertEquals(2, parsed.getValue().length);
    }

    @Test
    void bookmark_body_omits_expected_for_create() {
        assertEquals("{\"target\":\"42\"}", Cli.bookmarkBody("42", null));
        assertEquals("{\"target\":\"master\",\"expected\":\"7\"}", Cli.bookmarkBody("master", "7"));
    }

    @Test
    void query_values_are_url_encoded() {
        assertEquals("small%2Frelease", Cli.param("small/release"));
        assertEquals("a%20b", Cli.segment("a b"));
    }
}
