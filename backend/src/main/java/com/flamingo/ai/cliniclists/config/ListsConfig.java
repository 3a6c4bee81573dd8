package com.flamingo.ai.cliniclists.config;

import java.util.ArrayList;
import java.util.List;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Configuration properties for the list extraction pipeline. */
@Configuration
@ConfigurationProperties(prefix = "lists")
@Getter
@Setter
public class ListsConfig {

  private Boilerplate boilerplate = new Boilerplate();
  private Segmentation segmentation = new Segmentation();
  private Storage storage = new Storage();
  private Categories categories = new Categories();
  private Observations observations = new Observations();

  @Getter
  @Setter
  public static class Boilerplate {
    /** A normalized line seen more often than this within one section is treated as boilerplate. */
    private int frequencyThreshold = 5;

    /** Letterhead strings that are dropped when a line starts with them (case-insensitive). */
    private List<String> letterheadPatterns = new ArrayList<>(List.of("Apple Health"));
  }

  @Getter
  @Setter
  public static class Segmentation {
    /** Non-blank lines a date may wait for its record line before it is abandoned. */
    private int maxLinesWithoutRecord = 5;

    private int dateLineMaxLength = 50;
    private int minLineLength = 3;
    private int maxLineLength = 200;

    /** Prefix length of a record's content used to relocate it for page assignment. */
    private int anchorLength = 50;

    /** Clinical notes with a shorter cleaned body are dropped as false positives. */
    private int minNoteLength = 30;

    /** How far back from a {@code Created:} line to search for the note's date line. */
    private int noteLookbackLines = 20;
  }

  @Getter
  @Setter
  public static class Storage {
    /** Root directory of the filesystem object store. */
    private String basePath = "data/objects";

    /** Folder under each owner's prefix holding sources, lists and observation files. */
    private String listsFolder = "Lists";
  }

  @Getter
  @Setter
  public static class Categories {
    /** Upper bound for the text-generation call that enumerates headings. */
    private int timeoutSeconds = 60;
  }

  @Getter
  @Setter
  public static class Observations {
    /** Whether ingest also writes one observation file per {@code ###} category. */
    private boolean enabled = true;
  }
}
