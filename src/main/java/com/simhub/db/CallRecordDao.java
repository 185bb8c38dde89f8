package com.simhub.db;

import com.simhub.model.CallRecord;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * DAO для журнала звонков.
 */
public class CallRecordDao {

  private final Database database;

  public CallRecordDao(Database database) {
    this.database = database;
  }

  public boolean saveCall(CallRecord call) {
    String sql = """
        INSERT INTO call_records (dev_id, slot, phone_num, msg_type, call_type, start_time, duration_seconds, created_at)
        VALUES (?, ?, ?, ?, ?, ?, ?, ?)
        """;
    return database.execute(sql, call.getDevId(), call.getSlot(), call.getPhoneNum(), call.getMsgType(),
        call.getCallType(), call.getStartTime(), call.getDurationSeconds(), call.getCreatedAt()) > 0;
  }

  public List<CallRecord> getCallsByDevice(String devId) {
    List<CallRecord> records = new ArrayList<>();
    for (Map<String, Object> row : database.queryAll("SELECT * FROM call_records WHERE dev_id = ? ORDER BY id", devId)) {
      records.add(CallRecord.fromRow(row));
    }
    return records;
  }
}
