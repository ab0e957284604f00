package io.intellixity.sealquery.jdbc.postgres;

import io.intellixity.sealquery.format.EncryptedPayload;
import io.intellixity.sealquery.format.ResultFormatter;
import org.postgresql.util.PGobject;

import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Types;
import java.util.Objects;

/**
 * Binds encrypted payloads as {@code eql_v2_encrypted} parameters. The value sent is the payload's
 * composite literal; {@code null} binds SQL NULL.
 */
public final class EqlPostgresBinder {
  public static final String PG_TYPE = "eql_v2_encrypted";

  private final ResultFormatter formatter;

  public EqlPostgresBinder() {
    this(new ResultFormatter());
  }

  public EqlPostgresBinder(ResultFormatter formatter) {
    this.formatter = Objects.requireNonNull(formatter, "formatter");
  }

  public void bind(PreparedStatement ps, int position, EncryptedPayload payload) {
    try {
      if (payload == null) {
        ps.setNull(position, Types.OTHER);
        return;
      }
      PGobject obj = new PGobject();
      obj.setType(PG_TYPE);
      obj.setValue(formatter.compositeLiteral(payload));
      ps.setObject(position, obj);
    } catch (SQLException e) {
      throw new RuntimeException(e);
    }
  }

  /** Binds every value of {@code fragment} from {@code firstPosition}; returns the next free position. */
  public int bindAll(PreparedStatement ps, int firstPosition, SqlFragment fragment) {
    int pos = firstPosition;
    for (Object v : fragment.binds()) {
      if (!(v instanceof EncryptedPayload p)) {
        throw new IllegalArgumentException("Expected an encrypted payload bind, got " + v.getClass().getName());
      }
      bind(ps, pos++, p);
    }
    return pos;
  }
}
