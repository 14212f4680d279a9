package socialpublish.jdbc.store;

import socialpublish.StoreException;
import socialpublish.jdbc.JdbcTemplate;
import socialpublish.jdbc.spi.Dialect;
import socialpublish.jdbc.tx.JdbcTransactionManager;
import socialpublish.model.Document;
import socialpublish.model.OrderBy;
import socialpublish.model.Tag;
import socialpublish.spi.DocumentStore;
import socialpublish.spi.SiteWideDocumentReader;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.logging.Logger;

/**
 * {@link DocumentStore} over the {@code documents} and {@code document_tags} tables.
 *
 * <p>Each public call runs in its own transaction. {@link #createOrUpdate} reads then
 * writes inside that transaction, which is safe because the backing engine serializes
 * writers; a multi-writer engine would need an {@code ON CONFLICT} upsert instead.
 */
public final class JdbcDocumentStore implements DocumentStore {
  private static final Logger logger = Logger.getLogger(JdbcDocumentStore.class.getName());

  static final int TAG_LOOKUP_BATCH = 500;

  private static final String COLUMNS = "uuid, search_key, kind, payload, user_uuid, created_at";

  private static final JdbcTemplate.RowMapper<Document> DOCUMENT_ROW_MAPPER = rs -> {
    String owner = rs.getString("user_uuid");
    return new Document(
        rs.getString("uuid"),
        rs.getString("search_key"),
        rs.getString("kind"),
        List.of(),
        rs.getString("payload"),
        owner == null ? null : UUID.fromString(owner),
        Instant.ofEpochMilli(rs.getLong("created_at")));
  };

  private final JdbcTransactionManager txManager;
  private final JdbcTemplate jdbc;
  private final Dialect dialect;
  private final Clock clock;

  public JdbcDocumentStore(JdbcTransactionManager txManager, JdbcTemplate jdbc, Dialect dialect) {
    this(txManager, jdbc, dialect, Clock.systemUTC());
  }

  public JdbcDocumentStore(JdbcTransactionManager txManager, JdbcTemplate jdbc, Dialect dialect,
      Clock clock) {
    this.txManager = Objects.requireNonNull(txManager, "txManager");
    this.jdbc = Objects.requireNonNull(jdbc, "jdbc");
    this.dialect = Objects.requireNonNull(dialect, "dialect");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /**
   * Reader over all owners' documents, for whole-feed paths only.
   */
  public SiteWideDocumentReader siteWideReader() {
    return this::getAll;
  }

  @Override
  public Document createOrUpdate(String kind, String payload, UUID ownerId, String searchKey,
      List<Tag> tags) {
    Objects.requireNonNull(kind, "kind");
    Objects.requireNonNull(payload, "payload");
    Objects.requireNonNull(ownerId, "ownerId");
    List<Tag> tagSet = tags == null ? List.of() : List.copyOf(new LinkedHashSet<>(tags));
    try {
      return txManager.withTransaction(conn -> {
        if (searchKey != null) {
          Optional<Document> existing = jdbc.queryFirst(conn,
              "SELECT " + COLUMNS + " FROM documents WHERE search_key = ? AND user_uuid = ?",
              DOCUMENT_ROW_MAPPER, searchKey, ownerId.toString());
          if (existing.isPresent()) {
            Document current = existing.get();
            jdbc.update(conn, "UPDATE documents SET payload = ? WHERE uuid = ?", payload, current.uuid());
            replaceTags(conn, current.uuid(), tagSet);
            return current.withPayloadAndTags(payload, tagSet);
          }
        }
        String uuid = UUID.randomUUID().toString();
        String key = searchKey != null ? searchKey : kind + ":" + uuid;
        Instant createdAt = Instant.ofEpochMilli(clock.millis());
        jdbc.update(conn, "INSERT INTO documents (" + COLUMNS + ") VALUES (?, ?, ?, ?, ?, ?)",
            uuid, key, kind, payload, ownerId.toString(), createdAt.toEpochMilli());
        insertTags(conn, uuid, tagSet);
        return new Document(uuid, key, kind, tagSet, payload, ownerId, createdAt);
      });
    } catch (StoreException e) {
      throw new StoreException("Failed to create or update document of kind " + kind, e);
    }
  }

  @Override
  public Optional<Document> searchByKey(String searchKey) {
    Objects.requireNonNull(searchKey, "searchKey");
    return findOne("search_key", searchKey);
  }

  @Override
  public Optional<Document> searchByUuid(String uuid) {
    Objects.requireNonNull(uuid, "uuid");
    return findOne("uuid", uuid);
  }

  @Override
  public List<Document> getAllForUser(String kind, UUID ownerId, OrderBy orderBy) {
    Objects.requireNonNull(kind, "kind");
    Objects.requireNonNull(ownerId, "ownerId");
    try {
      return txManager.withTransaction(conn -> withTags(conn,
          jdbc.query(conn, "SELECT " + COLUMNS + " FROM documents WHERE kind = ? AND user_uuid = ?"
              + orderClause(orderBy), DOCUMENT_ROW_MAPPER, kind, ownerId.toString())));
    } catch (StoreException e) {
      throw new StoreException("Failed to list documents of kind " + kind, e);
    }
  }

  private List<Document> getAll(String kind, OrderBy orderBy) {
    Objects.requireNonNull(kind, "kind");
    try {
      return txManager.withTransaction(conn -> withTags(conn,
          jdbc.query(conn, "SELECT " + COLUMNS + " FROM documents WHERE kind = ?" + orderClause(orderBy),
              DOCUMENT_ROW_MAPPER, kind)));
    } catch (StoreException e) {
      throw new StoreException("Failed to list documents of kind " + kind, e);
    }
  }

  private Optional<Document> findOne(String column, String value) {
    try {
      return txManager.withTransaction(conn -> {
        Optional<Document> found = jdbc.queryFirst(conn,
            "SELECT " + COLUMNS + " FROM documents WHERE " + column + " = ?", DOCUMENT_ROW_MAPPER, value);
        if (found.isEmpty()) {
          return found;
        }
        Document doc = found.get();
        return Optional.of(doc.withTags(jdbc.query(conn,
            "SELECT name, kind FROM document_tags WHERE document_uuid = ? ORDER BY "
                + dialect.insertionOrderColumn(),
            rs -> new Tag(rs.getString("name"), rs.getString("kind")), doc.uuid())));
      });
    } catch (StoreException e) {
      throw new StoreException("Failed to look up document by " + column, e);
    }
  }

  private List<Document> withTags(Connection conn, List<Document> docs) throws SQLException {
    if (docs.isEmpty()) {
      return docs;
    }
    Map<String, List<Tag>> tagsByUuid = new LinkedHashMap<>();
    for (Document doc : docs) {
      tagsByUuid.put(doc.uuid(), new ArrayList<>());
    }
    // stays under SQLite's bound-parameter limit
    for (int from = 0; from < docs.size(); from += TAG_LOOKUP_BATCH) {
      List<Document> batch = docs.subList(from, Math.min(from + TAG_LOOKUP_BATCH, docs.size()));
      StringBuilder placeholders = new StringBuilder();
      for (int i = 0; i < batch.size(); i++) {
        placeholders.append(i == 0 ? "?" : ", ?");
      }
      jdbc.execute(conn,
          "SELECT document_uuid, name, kind FROM document_tags WHERE document_uuid IN ("
              + placeholders + ") ORDER BY " + dialect.insertionOrderColumn(),
          ps -> {
            for (int i = 0; i < batch.size(); i++) {
              ps.setString(i + 1, batch.get(i).uuid());
            }
          },
          rs -> tagsByUuid.get(rs.getString("document_uuid"))
              .add(new Tag(rs.getString("name"), rs.getString("kind"))));
    }
    List<Document> result = new ArrayList<>(docs.size());
    for (Document doc : docs) {
      result.add(doc.withTags(tagsByUuid.get(doc.uuid())));
    }
    return result;
  }

  private void replaceTags(Connection conn, String uuid, List<Tag> tags) throws SQLException {
    int removed = jdbc.update(conn, "DELETE FROM document_tags WHERE document_uuid = ?", uuid);
    insertTags(conn, uuid, tags);
    logger.fine("Replaced " + removed + " tags of document " + uuid + " with " + tags.size());
  }

  private void insertTags(Connection conn, String uuid, List<Tag> tags) throws SQLException {
    for (Tag tag : tags) {
      jdbc.update(conn, "INSERT INTO document_tags (document_uuid, name, kind) VALUES (?, ?, ?)",
          uuid, tag.name(), tag.kind());
    }
  }

  private String orderClause(OrderBy orderBy) {
    OrderBy order = orderBy == null ? OrderBy.CREATED_AT_DESC : orderBy;
    switch (order) {
      case CREATED_AT_DESC:
        return " ORDER BY created_at DESC, " + dialect.insertionOrderColumn() + " DESC";
      default:
        throw new IllegalArgumentException("Unsupported ordering: " + order);
    }
  }
}
