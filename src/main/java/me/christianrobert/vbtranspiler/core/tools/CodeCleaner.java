package me.christianrobert.vbtranspiler.core.tools;

import me.christianrobert.vbtranspiler.core.model.Language;

import java.util.function.UnaryOperator;

public class CodeCleaner {

  /**
   * Removes comments while keeping string literals and line breaks intact.
   * VB: ' to end of line. C#: // to end of line and /* ... *&#47; blocks.
   */
  public static String removeComments(String code, Language language) {
    if (code == null) {
      return null;
    }
    boolean vb = language.isKeywordDelimited();
    StringBuilder result = new StringBuilder();
    boolean inString = false;
    boolean inVerbatim = false;     // C# @"..."
    boolean inChar = false;         // C# 'x'
    boolean inLineComment = false;
    boolean inBlockComment = false;

    for (int i = 0; i < code.length(); i++) {
      char currentChar = code.charAt(i);
      char nextChar = (i + 1 < code.length()) ? code.charAt(i + 1) : '\0';

      if (inLineComment) {
        if (currentChar == '\n') {
          inLineComment = false;
          result.append(currentChar);
        }
        continue;
      }

      if (inBlockComment) {
        if (currentChar == '*' && nextChar == '/') {
          inBlockComment = false;
          i++;
        } else if (currentChar == '\n') {
          result.append(currentChar);
        }
        continue;
      }

      if (inString) {
        result.append(currentChar);
        if (currentChar == '\n' && !inVerbatim) {
          inString = false;
        } else if (!vb && !inVerbatim && currentChar == '\\') {
          if (nextChar != '\0') {
            result.append(nextChar);
            i++;
          }
        } else if (currentChar == '"') {
          if ((vb || inVerbatim) && nextChar == '"') {
            result.append(nextChar);
            i++;
          } else {
            inString = false;
            inVerbatim = false;
          }
        }
        continue;
      }

      if (inChar) {
        result.append(currentChar);
        if (currentChar == '\\' && nextChar != '\0') {
          result.append(nextChar);
          i++;
        } else if (currentChar == '\'' || currentChar == '\n') {
          inChar = false;
        }
        continue;
      }

      if (vb && currentChar == '\'') {
        inLineComment = true;
        continue;
      }
      if (!vb && currentChar == '/' && nextChar == '/') {
        inLineComment = true;
        i++;
        continue;
      }
      if (!vb && currentChar == '/' && nextChar == '*') {
        inBlockComment = true;
        i++;
        continue;
      }
      if (!vb && currentChar == '\'') {
        inChar = true;
        result.append(currentChar);
        continue;
      }
      if (currentChar == '"') {
        inString = true;
        inVerbatim = !vb && i > 0 && code.charAt(i - 1) == '@';
        result.append(currentChar);
        continue;
      }

      result.append(currentChar);
    }

    return result.toString();
  }

  /**
   * Replaces the content of string literals with spaces, keeping the quotes.
   * Input should already be comment-free.
   */
  public static String blankStringLiterals(String code, Language language) {
    if (code == null) {
      return null;
    }
    boolean vb = language.isKeywordDelimited();
    StringBuilder result = new StringBuilder(code.length());
    boolean inString = false;
    boolean inVerbatim = false;

    for (int i = 0; i < code.length(); i++) {
      char currentChar = code.charAt(i);
      char nextChar = (i + 1 < code.length()) ? code.charAt(i + 1) : '\0';

      if (!inString) {
        if (!vb && currentChar == '\'') {
          // char literal, copy through to the closing quote
          int end = i + 1;
          while (end < code.length() && code.charAt(end) != '\'' && code.charAt(end) != '\n') {
            end += code.charAt(end) == '\\' ? 2 : 1;
          }
          end = Math.min(end, code.length() - 1);
          result.append(code, i, end + 1);
          i = end;
          continue;
        }
        if (currentChar == '"') {
          inString = true;
          inVerbatim = !vb && i > 0 && code.charAt(i - 1) == '@';
        }
        result.append(currentChar);
        continue;
      }

      if (currentChar == '\n') {
        result.append(currentChar);
        if (!inVerbatim) {
          inString = false;
        }
      } else if (!vb && !inVerbatim && currentChar == '\\' && nextChar != '\0') {
        result.append("  ");
        i++;
      } else if (currentChar == '"') {
        if ((vb || inVerbatim) && nextChar == '"') {
          result.append("  ");
          i++;
        } else {
          inString = false;
          inVerbatim = false;
          result.append(currentChar);
        }
      } else {
        result.append(' ');
      }
    }

    return result.toString();
  }

  /**
   * Finds where a trailing line comment starts in a single line.
   *
   * @return index of the comment leader (' for VB, // for C#), or -1 if the line has none
   */
  public static int findLineCommentStart(String line, Language language) {
    boolean vb = language.isKeywordDelimited();
    boolean inString = false;
    boolean inVerbatim = false;
    boolean inChar = false;

    for (int i = 0; i < line.length(); i++) {
      char currentChar = line.charAt(i);
      char nextChar = (i + 1 < line.length()) ? line.charAt(i + 1) : '\0';

      if (inString) {
        if (!vb && !inVerbatim && currentChar == '\\') {
          i++;
        } else if (currentChar == '"') {
          if ((vb || inVerbatim) && nextChar == '"') {
            i++;
          } else {
            inString = false;
            inVerbatim = false;
          }
        }
        continue;
      }
      if (inChar) {
        if (currentChar == '\\') {
          i++;
        } else if (currentChar == '\'') {
          inChar = false;
        }
        continue;
      }

      if (currentChar == '"') {
        inString = true;
        inVerbatim = !vb && i > 0 && line.charAt(i - 1) == '@';
      } else if (vb && currentChar == '\'') {
        return i;
      } else if (!vb && currentChar == '\'') {
        inChar = true;
      } else if (!vb && currentChar == '/' && nextChar == '/') {
        return i;
      }
    }
    return -1;
  }

  /**
   * Applies a transformation to the parts of a single line that are outside string and char literals.
   * Literals are copied through unchanged.
   */
  public static String mapOutsideStrings(String line, Language language, UnaryOperator<String> transformation) {
    if (line == null || line.isEmpty()) {
      return line;
    }
    boolean vb = language.isKeywordDelimited();
    StringBuilder result = new StringBuilder(line.length());
    StringBuilder code = new StringBuilder();
    int i = 0;

    while (i < line.length()) {
      char currentChar = line.charAt(i);
      boolean charLiteral = !vb && currentChar == '\'';
      if (currentChar != '"' && !charLiteral) {
        code.append(currentChar);
        i++;
        continue;
      }

      boolean verbatim = !vb && currentChar == '"' && code.length() > 0 && code.charAt(code.length() - 1) == '@';
      if (verbatim) {
        code.setLength(code.length() - 1);
      }
      result.append(transformation.apply(code.toString()));
      code.setLength(0);

      int end = findLiteralEnd(line, i, currentChar, vb || verbatim);
      if (verbatim) {
        result.append('@');
      }
      result.append(line, i, end);
      i = end;
    }
    result.append(transformation.apply(code.toString()));
    return result.toString();
  }

  /**
   * Index after the closing quote of a literal starting at {@code start}, or the line length if unterminated.
   */
  private static int findLiteralEnd(String line, int start, char quote, boolean doubledQuotes) {
    int i = start + 1;
    while (i < line.length()) {
      char c = line.charAt(i);
      if (!doubledQuotes && c == '\\') {
        i += 2;
        continue;
      }
      if (c == quote) {
        if (doubledQuotes && i + 1 < line.length() && line.charAt(i + 1) == quote) {
          i += 2;
          continue;
        }
        return i + 1;
      }
      i++;
    }
    return line.length();
  }
}
