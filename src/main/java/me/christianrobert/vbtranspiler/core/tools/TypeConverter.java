package me.christianrobert.vbtranspiler.core.tools;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.function.UnaryOperator;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public class TypeConverter {

  private static final Pattern VB_TYPE = Pattern.compile(
      "^([\\w.]+)(?:\\(\\s*Of\\s+(.+?)\\))?(\\?)?((?:\\(\\))*)$", Pattern.CASE_INSENSITIVE);
  private static final Pattern CS_TYPE = Pattern.compile(
      "^([\\w.]+)(?:<(.+)>)?(\\?)?((?:\\[\\])*)$");

  /**
   * VB.NET type name to C#, including generics and arrays:
   * {@code List(Of Integer)} becomes {@code List<int>}, {@code String()} becomes {@code string[]}.
   */
  public static String toCSharp(String vbType) {
    if (vbType == null || vbType.isBlank()) {
      return vbType;
    }
    String type = vbType.trim();
    Matcher m = VB_TYPE.matcher(type);
    if (!m.matches()) {
      return type;
    }
    StringBuilder sb = new StringBuilder(primitiveToCSharp(m.group(1)));
    if (m.group(2) != null) {
      sb.append('<').append(convertArguments(m.group(2), TypeConverter::toCSharp)).append('>');
    }
    if (m.group(3) != null) {
      sb.append('?');
    }
    sb.append(m.group(4).replace("()", "[]"));
    return sb.toString();
  }

  /**
   * C# type name to VB.NET, the reverse of {@link #toCSharp(String)}.
   */
  public static String toVbNet(String csType) {
    if (csType == null || csType.isBlank()) {
      return csType;
    }
    String type = csType.trim();
    Matcher m = CS_TYPE.matcher(type);
    if (!m.matches()) {
      return type;
    }
    StringBuilder sb = new StringBuilder(primitiveToVbNet(m.group(1)));
    if (m.group(2) != null) {
      sb.append("(Of ").append(convertArguments(m.group(2), TypeConverter::toVbNet)).append(')');
    }
    if (m.group(3) != null) {
      sb.append('?');
    }
    sb.append(m.group(4).replace("[]", "()"));
    return sb.toString();
  }

  /**
   * VB6 type to VB.NET. Widths changed between the two: VB6 Integer is 16 bit, Long is 32 bit.
   */
  public static String vb6ToVbNet(String vb6Type) {
    if (vb6Type == null) {
      return null;
    }
    switch (vb6Type.trim().toLowerCase(Locale.ROOT)) {
      case "integer":
        return "Short";
      case "long":
        return "Integer";
      case "variant":
        return "Object";
      case "currency":
        return "Decimal";
      default:
        return vb6Type.trim();
    }
  }

  /**
   * VB.NET type to VB6, the reverse of {@link #vb6ToVbNet(String)}.
   * VB.NET Long has no 64 bit VB6 counterpart and is kept as Long.
   */
  public static String vbNetToVb6(String vbNetType) {
    if (vbNetType == null) {
      return null;
    }
    switch (vbNetType.trim().toLowerCase(Locale.ROOT)) {
      case "short":
        return "Integer";
      case "integer":
        return "Long";
      case "object":
        return "Variant";
      case "decimal":
        return "Currency";
      default:
        return vbNetType.trim();
    }
  }

  private static String primitiveToCSharp(String vbName) {
    switch (vbName.toLowerCase(Locale.ROOT)) {
      case "integer":
        return "int";
      case "uinteger":
        return "uint";
      case "long":
        return "long";
      case "ulong":
        return "ulong";
      case "short":
        return "short";
      case "ushort":
        return "ushort";
      case "byte":
        return "byte";
      case "sbyte":
        return "sbyte";
      case "single":
        return "float";
      case "double":
        return "double";
      case "decimal":
      case "currency":
        return "decimal";
      case "boolean":
        return "bool";
      case "char":
        return "char";
      case "string":
        return "string";
      case "object":
      case "variant":
        return "object";
      case "date":
        return "DateTime";
      default:
        return vbName;
    }
  }

  private static String primitiveToVbNet(String csName) {
    switch (csName) {
      case "int":
        return "Integer";
      case "uint":
        return "UInteger";
      case "long":
        return "Long";
      case "ulong":
        return "ULong";
      case "short":
        return "Short";
      case "ushort":
        return "UShort";
      case "byte":
        return "Byte";
      case "sbyte":
        return "SByte";
      case "float":
        return "Single";
      case "double":
        return "Double";
      case "decimal":
        return "Decimal";
      case "bool":
        return "Boolean";
      case "char":
        return "Char";
      case "string":
        return "String";
      case "object":
        return "Object";
      case "DateTime":
        return "Date";
      default:
        return csName;
    }
  }

  private static String convertArguments(String arguments, UnaryOperator<String> converter) {
    List<String> converted = new ArrayList<>();
    for (String argument : splitTopLevel(arguments, ',')) {
      converted.add(converter.apply(argument.trim()));
    }
    return String.join(", ", converted);
  }

  /**
   * Splits on a separator that is not nested in (), [] or &lt;&gt; and not inside a string literal.
   */
  public static List<String> splitTopLevel(String text, char separator) {
    List<String> parts = new ArrayList<>();
    int depth = 0;
    boolean inString = false;
    int start = 0;
    for (int i = 0; i < text.length(); i++) {
      char c = text.charAt(i);
      if (c == '"') {
        inString = !inString;
      } else if (!inString) {
        if (c == '(' || c == '[' || c == '<' || c == '{') {
          depth++;
        } else if (c == ')' || c == ']' || c == '>' || c == '}') {
          depth--;
        } else if (c == separator && depth == 0) {
          parts.add(text.substring(start, i));
          start = i + 1;
        }
      }
    }
    parts.add(text.substring(start));
    return parts;
  }
}
