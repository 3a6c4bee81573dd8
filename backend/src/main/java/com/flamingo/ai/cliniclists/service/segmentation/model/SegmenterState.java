package com.flamingo.ai.cliniclists.service.segmentation.model;

/**
 * Immutable state of the medication segmenter between two lines.
 *
 * @param phase current phase
 * @param date raw text of the controlling date line, empty while seeking
 * @param linesSinceDate non-blank lines seen since the date or since the record opened
 * @param draft the open record, or {@code null} outside {@link Phase#HAVE_RECORD}
 */
public record SegmenterState(Phase phase, String date, int linesSinceDate, RecordDraft draft) {

  public enum Phase {
    SEEKING_DATE,
    HAVE_DATE_NO_RECORD,
    HAVE_RECORD
  }

  public static SegmenterState seekingDate() {
    return new SegmenterState(Phase.SEEKING_DATE, "", 0, null);
  }

  public static SegmenterState haveDate(String date) {
    return new SegmenterState(Phase.HAVE_DATE_NO_RECORD, date, 0, null);
  }

  public SegmenterState withLinesSinceDate(int lines) {
    return new SegmenterState(phase, date, lines, draft);
  }

  public SegmenterState withRecord(RecordDraft openedDraft) {
    return new SegmenterState(Phase.HAVE_RECORD, date, 0, openedDraft);
  }

  public SegmenterState withDraft(RecordDraft updatedDraft, int lines) {
    return new SegmenterState(phase, date, lines, updatedDraft);
  }

  public boolean hasOpenRecord() {
    return draft != null && !draft.name().isEmpty();
  }

  /** A record still collecting lines. */
  public record RecordDraft(String date, String name, String value, String content) {

    public RecordDraft append(String line) {
      return new RecordDraft(date, name, value, content + "\n" + line);
    }

    public RecordDraft fillValue(String newValue, String line) {
      return new RecordDraft(date, name, newValue, content + "\n" + line);
    }
  }
}
