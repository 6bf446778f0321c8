/*
 * Copyright (C) 2026 ACME Delivery Services
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.acme.delivery.replication.pg;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decodes textual change records of the form
 * {@code table <schema>.<table>: <OPERATION>: key:value key:value ...}.
 *
 * <p>The grammar accepts both the plain rendering produced by {@link PgOutputRecordRenderer}
 * and the {@code test_decoding} output, where keys carry a {@code [type]} suffix and the
 * table and operation tokens end with a colon. Anything that is not an INSERT or UPDATE of a
 * known table in the configured schema decodes to {@code null}.
 */
public final class ChangeMessageDecoder {

  private static final Logger LOG = LoggerFactory.getLogger(ChangeMessageDecoder.class);

  private static final int PREVIEW_LENGTH = 200;
  private static final String OLD_KEY_MARKER = "old-key:";
  private static final String NEW_TUPLE_MARKER = "new-tuple:";

  private final String schema;
  private final String prefix;

  public ChangeMessageDecoder(String schema) {
    this.schema = Objects.requireNonNull(schema, "schema");
    this.prefix = "table " + schema + ".";
  }

  public String schema() {
    return schema;
  }

  public ChangeEvent decode(byte[] raw) {
    if (raw == null || raw.length == 0) {
      return null;
    }
    return decode(toText(raw));
  }

  public ChangeEvent decode(String payload) {
    if (payload == null || !payload.startsWith(prefix)) {
      if (payload != null && LOG.isDebugEnabled()) {
        LOG.debug("Ignoring record outside schema {}: {}", schema, preview(payload));
      }
      return null;
    }

    List<String> tokens = tokenize(payload);
    if (tokens == null || tokens.size() < 3) {
      LOG.warn("Skipping malformed change record: {}", preview(payload));
      return null;
    }

    String qualifiedTable = stripTrailingColon(tokens.get(1));
    String tableName = qualifiedTable.substring(schema.length() + 1);
    String operation = stripTrailingColon(tokens.get(2)).toUpperCase(Locale.ROOT);

    ChangeEvent.OperationKind kind;
    if ("INSERT".equals(operation)) {
      kind = ChangeEvent.OperationKind.INSERT;
    } else if ("UPDATE".equals(operation)) {
      kind = ChangeEvent.OperationKind.UPDATE;
    } else {
      LOG.debug("Ignoring {} on {}", operation, qualifiedTable);
      return null;
    }

    ChangeEvent.Entity entity = ChangeEvent.Entity.fromTable(tableName);
    if (entity == null) {
      LOG.debug("Ignoring change on untracked table {}", qualifiedTable);
      return null;
    }

    Map<String, String> fields = new LinkedHashMap<>();
    for (int i = 3; i < tokens.size(); i++) {
      String token = tokens.get(i);
      if (OLD_KEY_MARKER.equals(token)) {
        continue;
      }
      if (NEW_TUPLE_MARKER.equals(token)) {
        fields.clear();
        continue;
      }
      int separator = separatorIndex(token);
      if (separator <= 0) {
        continue;
      }
      String key = stripTypeSuffix(token.substring(0, separator));
      fields.put(key, parseValue(token.substring(separator + 1)));
    }

    return new ChangeEvent(entity, kind, qualifiedTable, fields);
  }

  static String toText(byte[] raw) {
    try {
      return StandardCharsets.UTF_8.newDecoder()
        .onMalformedInput(CodingErrorAction.REPORT)
        .onUnmappableCharacter(CodingErrorAction.REPORT)
        .decode(ByteBuffer.wrap(raw))
        .toString();
    } catch (CharacterCodingException e) {
      return new String(raw, StandardCharsets.ISO_8859_1);
    }
  }

  /**
   * Splits on whitespace outside single quotes and {@code [...]} type brackets.
   *
   * @return null when a quote or bracket is left open
   */
  static List<String> tokenize(String payload) {
    List<String> tokens = new ArrayList<>();
    StringBuilder current = new StringBuilder();
    boolean quoted = false;
    int brackets = 0;

    int length = payload.length();
    for (int i = 0; i < length; i++) {
      char c = payload.charAt(i);
      if (quoted) {
        current.append(c);
        if (c == '\'') {
          if (i + 1 < length && payload.charAt(i + 1) == '\'') {
            current.append('\'');
            i++;
          } else {
            quoted = false;
          }
        }
        continue;
      }
      if (c == '\'') {
        quoted = true;
        current.append(c);
      } else if (c == '[') {
        brackets++;
        current.append(c);
      } else if (c == ']' && brackets > 0) {
        brackets--;
        current.append(c);
      } else if (Character.isWhitespace(c) && brackets == 0) {
        if (current.length() > 0) {
          tokens.add(current.toString());
          current.setLength(0);
        }
      } else {
        current.append(c);
      }
    }

    if (quoted || brackets != 0) {
      return null;
    }
    if (current.length() > 0) {
      tokens.add(current.toString());
    }
    return tokens;
  }

  private static int separatorIndex(String token) {
    int brackets = 0;
    for (int i = 0; i < token.length(); i++) {
      char c = token.charAt(i);
      if (c == '\'') {
        return -1;
      }
      if (c == '[') {
        brackets++;
      } else if (c == ']') {
        brackets--;
      } else if (c == ':' && brackets == 0) {
        return i;
      }
    }
    return -1;
  }

  private static String stripTypeSuffix(String key) {
    int bracket = key.indexOf('[');
    return bracket > 0 ? key.substring(0, bracket) : key;
  }

  private static String parseValue(String raw) {
    if (raw.length() >= 2 && raw.charAt(0) == '\'' && raw.charAt(raw.length() - 1) == '\'') {
      return raw.substring(1, raw.length() - 1).replace("''", "'");
    }
    if ("null".equals(raw)) {
      return null;
    }
    return raw;
  }

  private static String stripTrailingColon(String token) {
    return token.endsWith(":") ? token.substring(0, token.length() - 1) : token;
  }

  private static String preview(String payload) {
    return payload.length() <= PREVIEW_LENGTH ? payload : payload.substring(0, PREVIEW_LENGTH) + "...";
  }
}
