/*
 * Copyright 2013 University of Chicago and Argonne National Laboratory
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License
 */
package exm.skc.frontend;

import java.util.ArrayList;
import java.util.List;

import org.apache.commons.lang3.StringUtils;

/**
 * Free-form Fortran source split into logical lines: comments
 * stripped, continuations joined, blank lines dropped and
 * semicolon-separated statements split.  Keeps the number of the
 * physical line each logical line started on for error messages.
 */
class SourceLines {

  static class Line {
    final int lineNum;
    /** Text as written, trimmed */
    final String text;
    /** Lower case text outside of string literals */
    final String lower;

    Line(int lineNum, String text) {
      this.lineNum = lineNum;
      this.text = text;
      this.lower = lowerOutsideStrings(text);
    }

    @Override
    public String toString() {
      return lineNum + ": " + text;
    }
  }

  private final List<Line> lines;
  private int pos = 0;

  SourceLines(String source) {
    this.lines = split(source);
  }

  boolean hasNext() {
    return pos < lines.size();
  }

  Line peek() {
    return hasNext() ? lines.get(pos) : null;
  }

  Line next() {
    return lines.get(pos++);
  }

  /**
   * @return line number of next line, or of the last line at the end
   */
  int lineNum() {
    if (hasNext()) {
      return lines.get(pos).lineNum;
    }
    return lines.isEmpty() ? 0 : lines.get(lines.size() - 1).lineNum;
  }

  private static List<Line> split(String source) {
    List<Line> result = new ArrayList<Line>();
    String[] physical = source.split("\r?\n", -1);
    StringBuilder pending = null;
    int startLine = 0;
    for (int i = 0; i < physical.length; i++) {
      String text = stripComment(physical[i]).trim();
      if (pending != null && text.startsWith("&")) {
        text = text.substring(1).trim();
      }
      boolean continues = text.endsWith("&");
      if (continues) {
        text = text.substring(0, text.length() - 1).trim();
      }
      if (pending == null) {
        pending = new StringBuilder(text);
        startLine = i + 1;
      } else if (text.length() > 0) {
        if (pending.length() > 0) {
          pending.append(' ');
        }
        pending.append(text);
      }
      if (!continues) {
        for (String stmt: splitStatements(pending.toString())) {
          if (stmt.length() > 0) {
            result.add(new Line(startLine, stmt));
          }
        }
        pending = null;
      }
    }
    if (pending != null && pending.length() > 0) {
      result.add(new Line(startLine, pending.toString()));
    }
    return result;
  }

  /**
   * Remove trailing comment.  Directives (!$...) are comments too.
   */
  static String stripComment(String line) {
    char quote = 0;
    for (int i = 0; i < line.length(); i++) {
      char c = line.charAt(i);
      if (quote != 0) {
        if (c == quote) {
          quote = 0;
        }
      } else if (c == '\'' || c == '"') {
        quote = c;
      } else if (c == '!') {
        return line.substring(0, i);
      }
    }
    return line;
  }

  private static List<String> splitStatements(String line) {
    List<String> result = new ArrayList<String>();
    char quote = 0;
    int start = 0;
    for (int i = 0; i < line.length(); i++) {
      char c = line.charAt(i);
      if (quote != 0) {
        if (c == quote) {
          quote = 0;
        }
      } else if (c == '\'' || c == '"') {
        quote = c;
      } else if (c == ';') {
        result.add(line.substring(start, i).trim());
        start = i + 1;
      }
    }
    result.add(line.substring(start).trim());
    return result;
  }

  static String lowerOutsideStrings(String text) {
    StringBuilder sb = new StringBuilder(text.length());
    char quote = 0;
    for (int i = 0; i < text.length(); i++) {
      char c = text.charAt(i);
      if (quote != 0) {
        if (c == quote) {
          quote = 0;
        }
        sb.append(c);
      } else {
        if (c == '\'' || c == '"') {
          quote = c;
        }
        sb.append(Character.toLowerCase(c));
      }
    }
    return sb.toString();
  }

  /**
   * Split on commas outside of brackets and string literals
   */
  static List<String> splitTopLevel(String text, char separator) {
    List<String> result = new ArrayList<String>();
    if (StringUtils.isBlank(text)) {
      return result;
    }
    int depth = 0;
    char quote = 0;
    int start = 0;
    for (int i = 0; i < text.length(); i++) {
      char c = text.charAt(i);
      if (quote != 0) {
        if (c == quote) {
          quote = 0;
        }
      } else if (c == '\'' || c == '"') {
        quote = c;
      } else if (c == '(') {
        depth++;
      } else if (c == ')') {
        depth--;
      } else if (c == separator && depth == 0) {
        result.add(text.substring(start, i).trim());
        start = i + 1;
      }
    }
    result.add(text.substring(start).trim());
    return result;
  }

  /**
   * @param text
   * @param open index of an opening bracket
   * @return index of the matching closing bracket, or -1
   */
  static int matchingParen(String text, int open) {
    int depth = 0;
    char quote = 0;
    for (int i = open; i < text.length(); i++) {
      char c = text.charAt(i);
      if (quote != 0) {
        if (c == quote) {
          quote = 0;
        }
      } else if (c == '\'' || c == '"') {
        quote = c;
      } else if (c == '(') {
        depth++;
      } else if (c == ')') {
        depth--;
        if (depth == 0) {
          return i;
        }
      }
    }
    return -1;
  }

  /**
   * @return index of the assignment '=' outside of brackets and
   *    strings, or -1 if there is none
   */
  static int assignmentEquals(String text) {
    int depth = 0;
    char quote = 0;
    for (int i = 0; i < text.length(); i++) {
      char c = text.charAt(i);
      if (quote != 0) {
        if (c == quote) {
          quote = 0;
        }
      } else if (c == '\'' || c == '"') {
        quote = c;
      } else if (c == '(') {
        depth++;
      } else if (c == ')') {
        depth--;
      } else if (c == '=' && depth == 0) {
        char prev = i > 0 ? text.charAt(i - 1) : ' ';
        char next = i + 1 < text.length() ? text.charAt(i + 1) : ' ';
        if (next != '=' && next != '>' && prev != '=' && prev != '/' &&
            prev != '<' && prev != '>') {
          return i;
        }
      }
    }
    return -1;
  }
}
