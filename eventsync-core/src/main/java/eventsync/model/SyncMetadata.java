package eventsync.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Provenance attached to every synced event.
 *
 * <p>Timestamps are kept as ISO-8601 strings because {@code originalCreatedAt} is copied
 * verbatim from the remote peer, whatever format it uses.
 *
 * @param synced            always {@code true} for records created by the sync bridge
 * @param sourceUrl         the peer the event came from, {@code null} for local origin
 * @param sourceName        the peer's self-reported name, may be {@code null}
 * @param originalId        the identifier the peer assigned
 * @param originalCreatedAt the peer's creation timestamp
 * @param pulledAt          when this side received the event
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SyncMetadata(
    @JsonProperty("synced") boolean synced,
    @JsonProperty("source_url") String sourceUrl,
    @JsonProperty("source_name") String sourceName,
    @JsonProperty("original_id") String originalId,
    @JsonProperty("original_created_at") String originalCreatedAt,
    @JsonProperty("pulled_at") String pulledAt
) {}
