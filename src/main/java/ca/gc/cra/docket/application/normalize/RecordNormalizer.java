package ca.gc.cra.docket.application.normalize;

import ca.gc.cra.docket.application.port.ClockPort;
import ca.gc.cra.docket.application.port.MetricsPort;
import ca.gc.cra.docket.domain.record.CanonicalComment;
import ca.gc.cra.docket.domain.record.CanonicalItem;
import ca.gc.cra.docket.domain.record.CreatedAt;
import ca.gc.cra.docket.domain.record.EmailHeaders;
import ca.gc.cra.docket.domain.record.ItemKind;
import ca.gc.cra.docket.domain.record.RawRecord;
import ca.gc.cra.docket.domain.record.SourcedItem;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Maps untrusted upstream records onto canonical items and comments.
 * <p><strong>Why:</strong> Payload shapes vary by tenant and version; every concept (id, timestamp, title, body,
 * headers) is read through a declarative {@link ProbeTable} so the fallbacks live in one place.</p>
 * <p><strong>Failure model:</strong> never throws on malformed input. Missing fields degrade to empty values; a
 * missing timestamp becomes the current time flagged as synthesized.</p>
 * <p><strong>Thread-safety:</strong> Stateless apart from its collaborators; safe for concurrent use.</p>
 *
 * @since 0.1.0
 */
public final class RecordNormalizer {
  private static final Logger log = LoggerFactory.getLogger(RecordNormalizer.class);

  static final ProbeTable<Instant> NOTE_TIME = ProbeTable.of("note.time", TimestampParser::parse,
      "createdDate", "created", "createDate", "postDate", "dateCreated", "date", "timestamp", "createdAt",
      "dateTime", "noteDate", "updatedDate");
  static final ProbeTable<Instant> EMAIL_TIME = ProbeTable.of("email.time", TimestampParser::parse,
      "sentDate", "dateSent", "dateReceived", "receivedDate", "date", "createdDate", "created", "dateCreated",
      "createDate", "timestamp", "createdAt", "dateTime", "emailDate", "updatedDate");
  static final ProbeTable<Instant> COMMENT_TIME = ProbeTable.of("comment.time", TimestampParser::parse,
      "createdDate", "created", "date", "dateCreated", "createDate", "timestamp", "createdAt", "dateTime",
      "commentDate", "updatedDate");

  static final ProbeTable<String> NOTE_BODY = ProbeTable.of("note.body", TextNormalizer::text,
      "text.text", "text", "body.html", "body.text", "body", "content.text", "content");
  static final ProbeTable<String> NOTE_TITLE = ProbeTable.of("note.title", TextNormalizer::text,
      "title", "subject");
  static final ProbeTable<String> EMAIL_BODY = ProbeTable.of("email.body", TextNormalizer::text,
      "body.html", "body.text", "body", "message.body.text", "message.body", "content", "text");
  static final ProbeTable<String> EMAIL_TITLE = ProbeTable.of("email.title", TextNormalizer::text,
      "subject", "title");
  static final ProbeTable<String> COMMENT_BODY = ProbeTable.of("comment.body", TextNormalizer::text,
      "body.html", "body.text", "body", "text.text", "text", "content");

  static final ProbeTable<String> EMAIL_FROM = ProbeTable.of("email.from", TextNormalizer::text,
      "from.displayName", "from.name", "from.email", "from", "sender.email", "sender");
  static final ProbeTable<List<String>> EMAIL_TO = ProbeTable.of("email.to", RecordNormalizer::addressList,
      "to", "toRecipients", "recipients.to");
  static final ProbeTable<List<String>> EMAIL_CC = ProbeTable.of("email.cc", RecordNormalizer::addressList,
      "cc", "ccRecipients", "recipients.cc");

  private static final ProbeTable<String> COMMON_ID = ProbeTable.of("id", Identifiers::scalar,
      "id.native", "id.id", "id");
  static final ProbeTable<String> NOTE_ID = COMMON_ID.then(ProbeTable.of("note.id", Identifiers::scalar, "noteId"));
  static final ProbeTable<String> EMAIL_ID = COMMON_ID.then(ProbeTable.of("email.id", Identifiers::scalar, "emailId"));
  static final ProbeTable<String> COMMENT_ID =
      COMMON_ID.then(ProbeTable.of("comment.id", Identifiers::scalar, "commentId"));

  private final ClockPort clock;
  private final MetricsPort metrics;

  /**
   * Creates a normalizer.
   *
   * @param clock source of synthesized timestamps
   * @param metrics metrics sink
   */
  public RecordNormalizer(ClockPort clock, MetricsPort metrics) {
    this.clock = Objects.requireNonNull(clock, "clock");
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
  }

  /**
   * Normalizes one note or e-mail record. The canonical id is {@code kind:sourceId}, or
   * {@code kind-anon-ordinal} when the record has no id.
   *
   * @param raw upstream record
   * @param kind entry kind
   * @return canonical item with an empty author and no comments
   */
  public CanonicalItem normalize(RawRecord raw, ItemKind kind) {
    Map<String, Object> fields = raw.fields();
    Optional<String> sourceId = sourceId(raw, kind);
    String id = sourceId.map(s -> kind.idPrefix() + ":" + s)
        .orElse(kind.idPrefix() + "-anon-" + raw.ordinal());
    if (kind == ItemKind.EMAIL) {
      EmailHeaders headers = new EmailHeaders(
          EMAIL_FROM.firstMatch(fields).orElse(""),
          EMAIL_TO.firstMatch(fields).orElse(List.of()),
          EMAIL_CC.firstMatch(fields).orElse(List.of()));
      return new CanonicalItem(kind, id, sourceId.orElse(""), createdAt(EMAIL_TIME, fields, id), "",
          EMAIL_TITLE.firstMatch(fields).orElse(""), EMAIL_BODY.firstMatch(fields).orElse(""), headers, List.of());
    }
    return new CanonicalItem(kind, id, sourceId.orElse(""), createdAt(NOTE_TIME, fields, id), "",
        NOTE_TITLE.firstMatch(fields).orElse(""), NOTE_BODY.firstMatch(fields).orElse(""), EmailHeaders.EMPTY,
        List.of());
  }

  /**
   * Normalizes a whole collection, keeping upstream order and making canonical ids unique within the run by
   * suffixing repeats with {@code #ordinal}.
   *
   * @param raws records in upstream order
   * @param kind entry kind
   * @return items paired with the record they came from
   */
  public List<SourcedItem> normalizeAll(List<RawRecord> raws, ItemKind kind) {
    List<SourcedItem> out = new ArrayList<>(raws.size());
    Set<String> seen = new HashSet<>();
    for (RawRecord raw : raws) {
      CanonicalItem item = normalize(raw, kind);
      String unique = uniqueId(item.id(), raw.ordinal(), seen);
      out.add(new SourcedItem(raw, unique.equals(item.id()) ? item : item.withId(unique)));
    }
    return out;
  }

  /**
   * Normalizes one comment record. The canonical id is {@code comment:sourceId}, or
   * {@code parentId/comment-anon-ordinal} when the record has no id.
   *
   * @param raw upstream comment record
   * @param parentId canonical id of the owning note
   * @return canonical comment with an empty author
   */
  public CanonicalComment normalizeComment(RawRecord raw, String parentId) {
    Map<String, Object> fields = raw.fields();
    String id = COMMENT_ID.firstMatch(fields)
        .map(s -> "comment:" + s)
        .orElse(parentId + "/comment-anon-" + raw.ordinal());
    return new CanonicalComment(id, createdAt(COMMENT_TIME, fields, id), "",
        COMMENT_BODY.firstMatch(fields).orElse(""));
  }

  /**
   * Upstream identifier of a record, unwrapped from {@code {native: X}} / {@code {id: X}} wrappers.
   *
   * @param raw upstream record
   * @param kind entry kind
   * @return source id, or empty when the record carries none
   */
  public static Optional<String> sourceId(RawRecord raw, ItemKind kind) {
    return (kind == ItemKind.EMAIL ? EMAIL_ID : NOTE_ID).firstMatch(raw.fields());
  }

  /**
   * Guarantees uniqueness of {@code id} among {@code seen}, recording the returned id.
   *
   * @param id candidate id
   * @param ordinal upstream position used as suffix
   * @param seen ids already issued; updated in place
   * @return {@code id} or a suffixed variant not yet in {@code seen}
   */
  static String uniqueId(String id, int ordinal, Set<String> seen) {
    String candidate = id;
    int bump = 0;
    while (!seen.add(candidate)) {
      candidate = id + "#" + (bump == 0 ? ordinal : ordinal + "." + bump);
      bump++;
    }
    return candidate;
  }

  private CreatedAt createdAt(ProbeTable<Instant> table, Map<String, Object> fields, String id) {
    Optional<Instant> observed = table.firstMatch(fields);
    if (observed.isPresent()) {
      return CreatedAt.observed(observed.get());
    }
    metrics.increment("normalize.timestamp.synthesized");
    log.debug("No parseable {} on {}; using current time", table.concept(), id);
    return CreatedAt.synthesized(clock.now());
  }

  private static Optional<List<String>> addressList(Object value) {
    List<String> out = new ArrayList<>();
    if (value instanceof Collection<?> entries) {
      for (Object entry : entries) {
        address(entry).ifPresent(out::add);
      }
    } else {
      address(value).ifPresent(out::add);
    }
    return out.isEmpty() ? Optional.empty() : Optional.of(List.copyOf(out));
  }

  private static Optional<String> address(Object entry) {
    if (entry instanceof Map<?, ?> map) {
      for (String key : List.of("email", "address", "displayName", "name")) {
        Optional<String> text = TextNormalizer.text(map.get(key));
        if (text.isPresent()) {
          return text;
        }
      }
      return Optional.empty();
    }
    return TextNormalizer.text(entry);
  }
}
