package com.acme.fabric.persistence.jdbc.mapper;

import com.acme.fabric.domain.Fabric;
import com.acme.fabric.domain.FabricStatus;
import java.sql.ResultSet;
import java.sql.SQLException;

/** Maps a {@code fabrics} row to the aggregate. */
public final class FabricMapper {

  private FabricMapper() {}

  public static Fabric toDomain(ResultSet rs) throws SQLException {
    return Fabric.restore(
        rs.getString("code"),
        rs.getString("name"),
        rs.getString("measure_unit"),
        rs.getString("offer_status"),
        FabricStatus.valueOf(rs.getString("status")),
        rs.getInt("version"));
  }
}
