package com.flamingo.ai.cliniclists.service.lists;

import com.flamingo.ai.cliniclists.config.ListsConfig;
import java.util.Locale;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Object keys used under an owner's lists folder.
 *
 * <pre>
 * {owner}/Lists/{cleanFile}                          source PDF copy
 * {owner}/Lists/{base}_results.json                  source document
 * {owner}/Lists/{base}_{category_snake}_list.json    list artifact
 * {owner}/Lists/{sanitized_category}.md              observation file
 * </pre>
 */
@Component
public class ListsStorageLayout {

  static final String PLACEHOLDER_SUFFIX = ".keep";

  private static final Pattern UNSAFE_FILE_CHARS = Pattern.compile("[^A-Za-z0-9.-]");
  private static final Pattern PDF_EXTENSION =
      Pattern.compile("\\.pdf$", Pattern.CASE_INSENSITIVE);
  private static final Pattern WHITESPACE = Pattern.compile("\\s+");
  private static final Pattern UNSAFE_CATEGORY_CHARS = Pattern.compile("[^A-Za-z0-9\\s-]");

  private final String listsFolder;

  public ListsStorageLayout(ListsConfig listsConfig) {
    this.listsFolder = listsConfig.getStorage().getListsFolder();
  }

  public String folder(String ownerId) {
    return ownerId + "/" + listsFolder + "/";
  }

  public String pdfKey(String ownerId, String fileName) {
    return folder(ownerId) + cleanFileName(fileName);
  }

  public String resultsKey(String ownerId, String fileName) {
    return folder(ownerId) + baseName(fileName) + "_results.json";
  }

  public String listKey(String ownerId, String fileName, String categoryName) {
    String categorySnake =
        WHITESPACE.matcher(categoryName.toLowerCase(Locale.ROOT)).replaceAll("_");
    return folder(ownerId) + baseName(fileName) + "_" + categorySnake + "_list.json";
  }

  public String observationKey(String ownerId, String categoryName) {
    String sanitized = UNSAFE_CATEGORY_CHARS.matcher(categoryName).replaceAll("");
    sanitized = WHITESPACE.matcher(sanitized).replaceAll("_").toLowerCase(Locale.ROOT);
    return folder(ownerId) + sanitized + ".md";
  }

  public boolean isOwnedBy(String ownerId, String key) {
    return key != null && key.startsWith(folder(ownerId)) && !key.contains("..");
  }

  public boolean isPlaceholder(String key) {
    return key.endsWith(PLACEHOLDER_SUFFIX);
  }

  static String cleanFileName(String fileName) {
    return UNSAFE_FILE_CHARS.matcher(fileName).replaceAll("_");
  }

  static String baseName(String fileName) {
    return PDF_EXTENSION.matcher(cleanFileName(fileName)).replaceFirst("");
  }
}
