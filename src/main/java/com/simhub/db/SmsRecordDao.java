package com.simhub.db;

import com.simhub.model.SmsRecord;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * DAO для журнала SMS.
 */
public class SmsRecordDao {

  private final Database database;

  public SmsRecordDao(Database database) {
    this.database = database;
  }

  public boolean saveSms(SmsRecord sms) {
    String sql = """
        INSERT INTO sms_records (dev_id, slot, phone_num, content, sms_time, direction, created_at)
        VALUES (?, ?, ?, ?, ?, ?, ?)
        """;
    return database.execute(sql, sms.getDevId(), sms.getSlot(), sms.getPhoneNum(), sms.getContent(),
        sms.getSmsTime(), sms.getDirection(), sms.getCreatedAt()) > 0;
  }

  public List<SmsRecord> getSmsByDevice(String devId) {
    List<SmsRecord> records = new ArrayList<>();
    for (Map<String, Object> row : database.queryAll("SELECT * FROM sms_records WHERE dev_id = ? ORDER BY id", devId)) {
      records.add(SmsRecord.fromRow(row));
    }
    return records;
  }
}
