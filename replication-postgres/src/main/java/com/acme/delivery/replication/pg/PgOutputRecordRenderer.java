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

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns binary {@code pgoutput} messages into the textual change record grammar read by
 * {@link ChangeMessageDecoder}, e.g. {@code table operations.orders INSERT order_id:'1' status:'PENDING'}.
 *
 * <p>Relation messages are remembered so later tuples can be named. Column values are copied
 * byte for byte, so text that is not valid UTF-8 reaches the decoder untouched. Messages
 * that carry no row image (transaction boundaries, relation and type metadata, truncate,
 * logical messages) and deletes render to {@code null}.
 */
public final class PgOutputRecordRenderer {

  private static final Logger LOG = LoggerFactory.getLogger(PgOutputRecordRenderer.class);

  private static final byte QUOTE = '\'';

  private final Map<Integer, Relation> relations = new HashMap<>();

  /**
   * @throws IllegalArgumentException when the message is truncated, of an unknown type, or
   *                                  references a relation that was never announced
   */
  public byte[] render(byte[] payload) {
    if (payload == null || payload.length == 0) {
      return null;
    }
    try {
      Cursor cursor = new Cursor(payload);
      char messageType = (char) cursor.readByte();
      switch (messageType) {
        case 'R':
          readRelation(cursor);
          return null;
        case 'I':
          return renderInsert(cursor);
        case 'U':
          return renderUpdate(cursor);
        case 'D':
          LOG.debug("Ignoring pgoutput delete");
          return null;
        case 'B':
        case 'C':
        case 'T':
        case 'Y':
        case 'O':
        case 'M':
          return null;
        default:
          throw new IllegalArgumentException("Unsupported pgoutput message type: " + messageType);
      }
    } catch (IndexOutOfBoundsException e) {
      throw new IllegalArgumentException("Truncated pgoutput message of " + payload.length + " bytes", e);
    }
  }

  private void readRelation(Cursor cursor) {
    int relationId = cursor.readInt();
    String schema = cursor.readCString();
    String table = cursor.readCString();
    cursor.readByte();
    int columnCount = cursor.readUnsignedShort();
    List<String> columns = new ArrayList<>(columnCount);
    for (int i = 0; i < columnCount; i++) {
      cursor.readByte();
      columns.add(cursor.readCString());
      cursor.readInt();
      cursor.readInt();
    }
    relations.put(relationId, new Relation(schema, table, columns));
  }

  private byte[] renderInsert(Cursor cursor) {
    Relation relation = relation(cursor.readInt());
    char marker = (char) cursor.readByte();
    if (marker != 'N') {
      throw new IllegalArgumentException("Unexpected tuple marker for INSERT: " + marker);
    }
    return renderTuple("INSERT", relation, cursor);
  }

  private byte[] renderUpdate(Cursor cursor) {
    Relation relation = relation(cursor.readInt());
    char marker = (char) cursor.readByte();
    if (marker == 'K' || marker == 'O') {
      skipTuple(cursor);
      marker = (char) cursor.readByte();
    }
    if (marker != 'N') {
      throw new IllegalArgumentException("Unexpected tuple marker for UPDATE: " + marker);
    }
    return renderTuple("UPDATE", relation, cursor);
  }

  private byte[] renderTuple(String operation, Relation relation, Cursor cursor) {
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    writeAscii(out, "table " + relation.schema + "." + relation.table + " " + operation);

    int columnCount = cursor.readUnsignedShort();
    for (int i = 0; i < columnCount; i++) {
      String column = i < relation.columns.size() ? relation.columns.get(i) : "col_" + i;
      char kind = (char) cursor.readByte();
      switch (kind) {
        case 'n':
          writeAscii(out, " " + column + ":null");
          break;
        case 'u':
          break;
        case 't': {
          int len = cursor.readInt();
          writeAscii(out, " " + column + ":");
          writeQuoted(out, cursor.bytes, cursor.index, len);
          cursor.skip(len);
          break;
        }
        case 'b': {
          int len = cursor.readInt();
          cursor.skip(len);
          LOG.debug("Skipping binary value of {}.{}.{}", relation.schema, relation.table, column);
          break;
        }
        default:
          throw new IllegalArgumentException("Unsupported tuple column kind: " + kind);
      }
    }
    return out.toByteArray();
  }

  private static void skipTuple(Cursor cursor) {
    int columnCount = cursor.readUnsignedShort();
    for (int i = 0; i < columnCount; i++) {
      char kind = (char) cursor.readByte();
      if (kind == 't' || kind == 'b') {
        cursor.skip(cursor.readInt());
      }
    }
  }

  private Relation relation(int relationId) {
    Relation relation = relations.get(relationId);
    if (relation == null) {
      throw new IllegalArgumentException("pgoutput relation metadata missing for relation id " + relationId);
    }
    return relation;
  }

  private static void writeAscii(ByteArrayOutputStream out, String text) {
    byte[] bytes = text.getBytes(StandardCharsets.UTF_8);
    out.write(bytes, 0, bytes.length);
  }

  private static void writeQuoted(ByteArrayOutputStream out, byte[] source, int offset, int len) {
    if (offset + len > source.length) {
      throw new IndexOutOfBoundsException("Column value runs past the end of the message");
    }
    out.write(QUOTE);
    for (int i = offset; i < offset + len; i++) {
      byte b = source[i];
      out.write(b);
      if (b == QUOTE) {
        out.write(QUOTE);
      }
    }
    out.write(QUOTE);
  }

  private static final class Relation {
    private final String schema;
    private final String table;
    private final List<String> columns;

    private Relation(String schema, String table, List<String> columns) {
      this.schema = schema;
      this.table = table;
      this.columns = columns;
    }
  }

  private static final class Cursor {
    private final byte[] bytes;
    private int index;

    private Cursor(byte[] bytes) {
      this.bytes = bytes;
    }

    private byte readByte() {
      return bytes[index++];
    }

    private int readUnsignedShort() {
      int value = ((bytes[index] & 0xff) << 8) | (bytes[index + 1] & 0xff);
      index += 2;
      return value;
    }

    private int readInt() {
      int value = ((bytes[index] & 0xff) << 24)
        | ((bytes[index + 1] & 0xff) << 16)
        | ((bytes[index + 2] & 0xff) << 8)
        | (bytes[index + 3] & 0xff);
      index += 4;
      return value;
    }

    private String readCString() {
      int start = index;
      while (bytes[index] != 0) {
        index++;
      }
      String out = new String(bytes, start, index - start, StandardCharsets.UTF_8);
      index++;
      return out;
    }

    private void skip(int len) {
      if (len < 0 || index + len > bytes.length) {
        throw new IndexOutOfBoundsException("Cannot skip " + len + " bytes at offset " + index);
      }
      index += len;
    }
  }
}
