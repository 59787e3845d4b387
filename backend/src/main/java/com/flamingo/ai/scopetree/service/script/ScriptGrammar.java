package com.flamingo.ai.scopetree.service.script;

import org.treesitter.TSLanguage;
import org.treesitter.TSParser;
import org.treesitter.TSTree;
import org.treesitter.TreeSitterTypescript;

/**
 * Tree-sitter grammar used for every script file.
 *
 * <p>The bundled TypeScript grammar also accepts JavaScript and JSX, so one grammar serves ts,
 * tsx, js, jsx and unknown extensions alike.
 */
final class ScriptGrammar {

  private static final TSLanguage LANGUAGE = new TreeSitterTypescript();

  private ScriptGrammar() {}

  /** Parses {@code source} with a fresh parser; parsers are not shared between threads. */
  static TSTree parse(String source) {
    TSParser parser = new TSParser();
    parser.setLanguage(LANGUAGE);
    return parser.parseString(null, source);
  }
}
