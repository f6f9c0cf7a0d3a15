// Copyright (C) 2017 The Android Open Source Project
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
// http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.

package com.googlesource.ownersdb;

import com.google.common.base.Joiner;
import com.google.common.flogger.FluentLogger;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parse lines in an OWNERS file into a list of directives.
 * One Parser object should be created to parse only one OWNERS file.
 * It keeps the repository path of the file only to report syntax errors;
 * it knows nothing about the directory tree, so "file:" targets are
 * returned as written and resolved by OwnersDb.
 *
 * The usage pattern is:
 *   Parser parser = new Parser("src/OWNERS", emailPattern);
 *   List<Parser.Directive> directives = parser.parseFile(lines);
 *
 * Syntax, one directive per line after trimming surrounding spaces:
 *   # comment                  attached to the next directive
 *   set noparent               stop looking for owners in parent directories
 *   per-file glob=directive    directive applies only to files matching glob
 *   file:path                  include owners of another OWNERS file
 *   email@domain or *          an owner of every file in this directory
 */
class Parser {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  // If this is present by itself on a line, this means that everyone can review.
  static final String EVERYONE = "*";

  static final String TOK_SET_NOPARENT = "set noparent";
  static final String TOK_FILE = "file:";
  private static final String TOK_SET = "set ";

  // Recognizes 'X@Y' email addresses. Very simplistic.
  static final String BASIC_EMAIL_REGEXP = "^[\\w\\-\\+\\%\\.]+\\@[\\w\\-\\+\\%\\.]+$";

  // Splits a per-file line into (1) glob and (2) directive, both trimmed later.
  private static final Pattern PAT_PER_FILE = Pattern.compile("^per-file (.+)=(.+)$");

  // Whole-file comments keep their line breaks; per-file comments are folded to one line.
  private static final Joiner LINE_JOINER = Joiner.on('\n');
  private static final Joiner PER_FILE_JOINER = Joiner.on(' ');

  /** One parsed instruction of an OWNERS file. */
  static class Directive {
    enum Kind {
      GRANT, // value is an email or EVERYONE
      NO_PARENT, // value is null
      INCLUDE // value is the include target as written after "file:"
    }

    final Kind kind;
    final String glob; // per-file glob, or null for a whole-directory directive
    final String value;
    final String comment; // comment block preceding the directive, "" if none
    final int lineNumber;

    Directive(Kind kind, String glob, String value, String comment, int lineNumber) {
      this.kind = kind;
      this.glob = glob;
      this.value = value;
      this.comment = comment;
      this.lineNumber = lineNumber;
    }

    boolean isPerFile() {
      return glob != null;
    }

    @Override
    public String toString() {
      return lineNumber + ":" + kind + (glob != null ? "[" + glob + "]" : "") + ":" + value;
    }
  }

  private final String ownersPath;
  private final Pattern emailPattern;

  Parser(String ownersPath) {
    this(ownersPath, Pattern.compile(BASIC_EMAIL_REGEXP));
  }

  Parser(String ownersPath, Pattern emailPattern) {
    this.ownersPath = ownersPath;
    this.emailPattern = emailPattern;
  }

  boolean isEmail(String s) {
    return emailPattern.matcher(s).matches();
  }

  /**
   * Parse all lines of an OWNERS file.
   *
   * @param lines source lines of the file, without line terminators.
   * @return the directives in source order.
   * @throws OwnersSyntaxException at the first malformed line.
   */
  List<Directive> parseFile(List<String> lines) throws OwnersSyntaxException {
    List<Directive> result = new ArrayList<>();
    List<String> comment = new ArrayList<>();
    boolean inComment = false;
    int n = 0;
    for (String rawLine : lines) {
      n++;
      String line = rawLine.trim();
      if (line.startsWith("#")) {
        if (!inComment) {
          comment = new ArrayList<>();
        }
        comment.add(line.substring(1).trim());
        inComment = true;
        continue;
      }
      inComment = false;
      if (!line.isEmpty()) {
        result.add(parseLine(line, n, comment));
      }
      comment = new ArrayList<>();
    }
    logger.atFinest().log("parsed %d directives from %s", result.size(), ownersPath);
    return result;
  }

  List<Directive> parseFile(String content) throws OwnersSyntaxException {
    return parseFile(List.of(content.split("\\R")));
  }

  /**
   * Parse one trimmed, non-empty, non-comment line.
   *
   * @param line the source line.
   * @param num the 1-based line number.
   * @param comment the comment lines preceding this line.
   */
  Directive parseLine(String line, int num, List<String> comment) throws OwnersSyntaxException {
    if (line.equals(TOK_SET_NOPARENT)) {
      return new Directive(Directive.Kind.NO_PARENT, null, null, LINE_JOINER.join(comment), num);
    }
    Matcher m = PAT_PER_FILE.matcher(line);
    if (m.matches()) {
      String glob = m.group(1).trim();
      String directive = m.group(2).trim();
      if (glob.contains("/") || glob.contains("\\")) {
        throw syntaxError(
            num, "per-file globs cannot span directories or use escapes: \"" + glob + "\"");
      }
      String invalid = GlobMatcher.checkGlob(glob);
      if (invalid != null) {
        throw syntaxError(num, "invalid per-file glob \"" + glob + "\": " + invalid);
      }
      return parseDirective(glob, directive, "per-file line", num, PER_FILE_JOINER.join(comment));
    }
    if (line.startsWith(TOK_SET)) {
      throw syntaxError(num, "unknown option: \"" + line.substring(TOK_SET.length()).trim() + "\"");
    }
    return parseDirective(null, line, "line", num, LINE_JOINER.join(comment));
  }

  private Directive parseDirective(
      String glob, String directive, String lineType, int num, String comment)
      throws OwnersSyntaxException {
    if (directive.equals(TOK_SET_NOPARENT)) {
      return new Directive(Directive.Kind.NO_PARENT, glob, null, comment, num);
    }
    if (directive.startsWith(TOK_FILE)) {
      String target = directive.substring(TOK_FILE.length()).trim();
      return new Directive(Directive.Kind.INCLUDE, glob, target, comment, num);
    }
    if (isEmail(directive) || directive.equals(EVERYONE)) {
      return new Directive(Directive.Kind.GRANT, glob, directive, comment, num);
    }
    throw syntaxError(
        num,
        String.format(
            "%s is not a \"set\" directive, file include, \"*\", or an email address: \"%s\"",
            lineType, directive));
  }

  OwnersSyntaxException syntaxError(int num, String msg) {
    return new OwnersSyntaxException(ownersPath, num, msg);
  }
}
