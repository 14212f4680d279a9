package socialpublish.jdbc.store;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import socialpublish.SqlUpdateException;
import socialpublish.StoreException;
import socialpublish.jdbc.Database;
import socialpublish.jdbc.DatabaseConfig;
import socialpublish.model.Document;
import socialpublish.model.OrderBy;
import socialpublish.model.Tag;
import socialpublish.spi.DocumentStore;
import socialpublish.spi.SiteWideDocumentReader;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Document store behavior shared by every supported engine.
 * Subclasses provide the JDBC URL.
 */
abstract class AbstractDocumentStoreTest {
  private static final UUID ALICE = UUID.fromString("11111111-1111-1111-1111-111111111111");
  private static final UUID BOB = UUID.fromString("22222222-2222-2222-2222-222222222222");

  private final MutableClock clock = new MutableClock(Instant.parse("2024-05-01T10:00:00Z"));
  private Database db;
  private DocumentStore store;
  private SiteWideDocumentReader siteWide;

  abstract String jdbcUrl();

  @BeforeEach
  void openDatabase() {
    db = Database.open(new DatabaseConfig()
        .setJdbcUrl(jdbcUrl())
        .setPasswordHasher(raw -> "hashed:" + raw)
        .setClock(clock));
    store = db.documentStore();
    siteWide = db.siteWideReader();
  }

  @AfterEach
  void closeDatabase() {
    db.close();
  }

  @Test
  void upsertBySearchKeyKeepsIdentity() {
    Document created = store.createOrUpdate("post", "hi", ALICE, "post:abc", List.of(Tag.target("mastodon")));
    clock.advanceMillis(5_000);

    Document updated = store.createOrUpdate("post", "bye", ALICE, "post:abc", List.of(Tag.target("bluesky")));

    assertEquals(created.uuid(), updated.uuid());
    assertEquals(created.createdAt(), updated.createdAt());
    assertEquals("bye", updated.payload());
    assertEquals(List.of(Tag.target("bluesky")), updated.tags());

    Document found = store.searchByKey("post:abc").orElseThrow();
    assertEquals(created.uuid(), found.uuid());
    assertEquals("bye", found.payload());
    assertEquals(List.of(Tag.target("bluesky")), found.tags());
    assertEquals(created.createdAt(), found.createdAt());
    assertEquals(ALICE, found.ownerId());
  }

  @Test
  void missingSearchKeyDefaultsToKindAndUuid() {
    Document doc = store.createOrUpdate("post", "{}", ALICE, null, List.of());

    assertEquals("post:" + doc.uuid(), doc.searchKey());
    assertEquals(clock.instant(), doc.createdAt());
    assertEquals(doc, store.searchByUuid(doc.uuid()).orElseThrow());
  }

  @Test
  void withoutSearchKeyEveryWriteInserts() {
    Document first = store.createOrUpdate("post", "a", ALICE, null, null);
    Document second = store.createOrUpdate("post", "a", ALICE, null, null);

    assertNotEquals(first.uuid(), second.uuid());
    assertEquals(2, store.getAllForUser("post", ALICE, OrderBy.CREATED_AT_DESC).size());
  }

  @Test
  void tagsAreReplacedAsAWholeAndKeepTheirOrder() {
    store.createOrUpdate("post", "x", ALICE, "k1",
        List.of(Tag.target("twitter"), Tag.target("mastodon"), Tag.label("news")));

    store.createOrUpdate("post", "x", ALICE, "k1", List.of(Tag.label("rust"), Tag.target("bluesky")));

    Document doc = store.searchByKey("k1").orElseThrow();
    assertEquals(List.of(Tag.label("rust"), Tag.target("bluesky")), doc.tags());
    assertEquals(List.of("bluesky"), doc.tagNames(Tag.KIND_TARGET));
  }

  @Test
  void duplicateTagsAreStoredOnce() {
    Document doc = store.createOrUpdate("post", "x", ALICE, null,
        List.of(Tag.target("feed"), Tag.target("feed"), Tag.label("feed")));

    assertEquals(List.of(Tag.target("feed"), Tag.label("feed")), doc.tags());
    assertEquals(doc.tags(), store.searchByUuid(doc.uuid()).orElseThrow().tags());
  }

  @Test
  void listingIsScopedToOwnerAndKind() {
    store.createOrUpdate("post", "alice-1", ALICE, null, List.of());
    store.createOrUpdate("post", "bob-1", BOB, null, List.of());
    store.createOrUpdate("draft", "alice-draft", ALICE, null, List.of());

    List<Document> alicePosts = store.getAllForUser("post", ALICE, OrderBy.CREATED_AT_DESC);

    assertEquals(List.of("alice-1"), alicePosts.stream().map(Document::payload).toList());
    assertTrue(store.getAllForUser("post", UUID.randomUUID(), OrderBy.CREATED_AT_DESC).isEmpty());
  }

  @Test
  void listingLoadsTagsForMoreDocumentsThanOneLookupBatch() {
    int count = JdbcDocumentStore.TAG_LOOKUP_BATCH + 1;
    for (int i = 0; i < count; i++) {
      store.createOrUpdate("post", "p" + i, ALICE, "key-" + i, List.of(Tag.label("n" + i)));
    }

    List<Document> docs = store.getAllForUser("post", ALICE, OrderBy.CREATED_AT_DESC);

    assertEquals(count, docs.size());
    for (Document doc : docs) {
      assertEquals(List.of(Tag.label("n" + doc.searchKey().substring("key-".length()))), doc.tags());
    }
  }

  @Test
  void listingIsNewestFirstWithTiesInReverseInsertionOrder() {
    store.createOrUpdate("post", "oldest", ALICE, null, List.of());
    clock.advanceMillis(1_000);
    store.createOrUpdate("post", "tie-1", ALICE, null, List.of(Tag.target("a")));
    store.createOrUpdate("post", "tie-2", ALICE, null, List.of(Tag.target("b")));
    clock.advanceMillis(1_000);
    store.createOrUpdate("post", "newest", ALICE, null, List.of());

    List<Document> docs = store.getAllForUser("post", ALICE, null);

    assertEquals(List.of("newest", "tie-2", "tie-1", "oldest"),
        docs.stream().map(Document::payload).toList());
    assertEquals(List.of(Tag.target("b")), docs.get(1).tags());
    assertEquals(List.of(Tag.target("a")), docs.get(2).tags());
  }

  @Test
  void siteWideReaderSpansOwners() {
    store.createOrUpdate("post", "alice-1", ALICE, null, List.of());
    clock.advanceMillis(1);
    store.createOrUpdate("post", "bob-1", BOB, null, List.of(Tag.target("feed")));
    store.createOrUpdate("draft", "bob-draft", BOB, null, List.of());

    List<Document> all = siteWide.getAll("post", OrderBy.CREATED_AT_DESC);

    assertEquals(List.of("bob-1", "alice-1"), all.stream().map(Document::payload).toList());
    assertEquals(List.of(Tag.target("feed")), all.get(0).tags());
  }

  @Test
  void searchKeyTakenByAnotherOwnerIsAUniqueViolation() {
    Document original = store.createOrUpdate("post", "alice", ALICE, "shared", List.of(Tag.target("feed")));

    StoreException e = assertThrows(StoreException.class,
        () -> store.createOrUpdate("post", "bob", BOB, "shared", List.of()));

    Optional<SqlUpdateException> violation = e.violation();
    assertTrue(violation.isPresent(), "expected a classified violation");
    assertInstanceOf(SqlUpdateException.UniqueViolation.class, violation.get());

    Document stored = store.searchByKey("shared").orElseThrow();
    assertEquals(original.uuid(), stored.uuid());
    assertEquals("alice", stored.payload());
    assertEquals(List.of(Tag.target("feed")), stored.tags());
  }

  @Test
  void lookupsThatMatchNothingAreEmpty() {
    assertTrue(store.searchByKey("nope").isEmpty());
    assertTrue(store.searchByUuid(UUID.randomUUID().toString()).isEmpty());
    assertTrue(siteWide.getAll("post", OrderBy.CREATED_AT_DESC).isEmpty());
  }

  @Test
  void requiredArgumentsAreChecked() {
    assertThrows(NullPointerException.class, () -> store.createOrUpdate(null, "x", ALICE, null, List.of()));
    assertThrows(NullPointerException.class, () -> store.createOrUpdate("post", null, ALICE, null, List.of()));
    assertThrows(NullPointerException.class, () -> store.createOrUpdate("post", "x", null, null, List.of()));
  }

  static final class MutableClock extends Clock {
    private volatile Instant now;

    MutableClock(Instant start) {
      this.now = start;
    }

    void advanceMillis(long millis) {
      now = now.plusMillis(millis);
    }

    @Override
    public ZoneId getZone() {
      return ZoneOffset.UTC;
    }

    @Override
    public Clock withZone(ZoneId zone) {
      return this;
    }

    @Override
    public Instant instant() {
      return now;
    }
  }
}
