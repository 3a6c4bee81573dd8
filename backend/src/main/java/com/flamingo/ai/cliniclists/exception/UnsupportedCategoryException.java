package com.flamingo.ai.cliniclists.exception;

/** Exception thrown when a category cannot be processed into a record list. */
public class UnsupportedCategoryException extends RuntimeException {

  private final String categoryName;

  public UnsupportedCategoryException(String categoryName) {
    super(
        "Category \""
            + categoryName
            + "\" is not supported yet. Only \"Medication Records\" and \"Clinical Notes\""
            + " can be processed.");
    this.categoryName = categoryName;
  }

  public String getCategoryName() {
    return categoryName;
  }
}
