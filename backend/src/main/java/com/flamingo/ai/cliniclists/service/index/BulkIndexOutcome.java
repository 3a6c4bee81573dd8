package com.flamingo.ai.cliniclists.service.index;

import java.util.List;

/**
 * Result of a bulk write.
 *
 * @param indexed records stored
 * @param errors one message per failed record, or a single message when the whole request failed
 */
public record BulkIndexOutcome(int indexed, List<String> errors) {

  public BulkIndexOutcome {
    errors = errors == null ? List.of() : List.copyOf(errors);
  }

  public static BulkIndexOutcome failed(String error) {
    return new BulkIndexOutcome(0, List.of(error));
  }
}
