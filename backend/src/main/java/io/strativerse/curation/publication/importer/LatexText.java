package io.strativerse.curation.publication.importer;

import java.util.List;
import org.jbibtex.LaTeXObject;
import org.jbibtex.LaTeXParser;
import org.jbibtex.LaTeXPrinter;
import org.jbibtex.ParseException;
import org.jbibtex.TokenMgrException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Converts BibTeX field text containing LaTeX markup to plain text. */
final class LatexText {

  private static final Logger log = LoggerFactory.getLogger(LatexText.class);

  private LatexText() {}

  /**
   * Plain-text rendering of {@code latex}: accents converted, grouping braces removed. Text the
   * LaTeX parser rejects falls back to brace stripping.
   */
  static String toPlain(String latex) {
    if (latex == null || latex.isBlank()) {
      return latex == null ? "" : latex.strip();
    }
    try {
      LaTeXParser parser = new LaTeXParser();
      List<LaTeXObject> objects = parser.parse(latex);
      return new LaTeXPrinter().print(objects).replaceAll("\\s+", " ").strip();
    } catch (ParseException | TokenMgrException e) {
      log.debug("Falling back to brace stripping for '{}': {}", latex, e.getMessage());
      return latex.replace("{", "").replace("}", "").replaceAll("\\s+", " ").strip();
    }
  }
}
