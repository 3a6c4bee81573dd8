package com.flamingo.ai.cliniclists.elasticsearch;

import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A clinical record as stored in Elasticsearch, stamped with its owner.
 *
 * <p>{@code id} is the Elasticsearch document id; {@code recordId} is the record's own id.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ClinicalRecordDocument {

  private String id;
  private String ownerId;
  private String recordId;
  private String fileName;
  private String name;
  private String value;
  private String category;
  private String date;
  private int page;
  private String location;
  private String type;
  private String author;
  private String created;
  private String content;
  private String markdown;
  private Instant indexedAt;
}
