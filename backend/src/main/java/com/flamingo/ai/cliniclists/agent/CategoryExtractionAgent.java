package com.flamingo.ai.cliniclists.agent;

import dev.langchain4j.service.UserMessage;
import dev.langchain4j.service.V;

/**
 * AI agent that enumerates the {@code ###} headings of a document and how often each occurs.
 *
 * <p>The reply is free text, one {@code Category Name: count} per line, and is parsed
 * heuristically.
 */
public interface CategoryExtractionAgent {

  @UserMessage(
      """
        List the top-level (### ....) markdown categories and the number of occurrences of \
        that heading in the file.

        Here is the markdown file:

        {{markdown}}

        Please provide a list of all top-level markdown categories (### headings) and the \
        count of each one. Format your response as a simple list, one category per line, \
        with the format: "Category Name: count"
        """)
  String listCategories(@V("markdown") String markdown);
}
