package de.bsommerfeld.forum.core.domain;

import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RecordTypesTest {

    private static final LocalDateTime NOW = LocalDateTime.of(2024, 3, 1, 10, 15, 30);

    @Test
    void user_toStringShouldNotExposeCredential() {
        User user = new User(1, "Ada", "Lovelace", "ada@example.com",
                "$pbkdf2-sha512$25000$salt$checksum", false, null, NOW);

        String text = user.toString();
        assertFalse(text.contains("pbkdf2"));
        assertTrue(text.contains("password=<redacted>"));
        assertTrue(text.contains("ada@example.com"));
    }

    @Test
    void user_equalityShouldStillIncludeCredential() {
        User a = new User(1, "A", "B", "a@x.com", "hash-1", false, null, NOW);
        User b = new User(1, "A", "B", "a@x.com", "hash-2", false, null, NOW);
        assertNotEquals(a, b);
    }

    @Test
    void tag_idsOfShouldPreserveOrderAndDropDuplicates() {
        Tag java = new Tag(3, "java", null, "#f89820", NOW);
        Tag sql = new Tag(1, "sql", "Queries", "#336791", NOW);

        assertEquals(List.of(3, 1), List.copyOf(Tag.idsOf(List.of(java, sql, java))));
    }

    @Test
    void comment_isDeletedShouldFollowMarker() {
        assertFalse(new Comment(1, 1, 1, "hi", NOW, null, null).isDeleted());
        assertTrue(new Comment(1, 1, 1, "hi", NOW, null, NOW.plusDays(1)).isDeleted());
    }

    @Test
    void postTag_shouldUsePairAsIdentity() {
        assertEquals(new PostTag(1, 2), new PostTag(1, 2));
        assertNotEquals(new PostTag(1, 2), new PostTag(2, 1));
    }
}
