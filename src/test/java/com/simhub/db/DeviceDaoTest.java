package com.simhub.db;

import com.simhub.model.CallRecord;
import com.simhub.model.Device;
import com.simhub.model.DeviceStatus;
import com.simhub.model.SmsRecord;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class DeviceDaoTest {

  private static final String T1 = "2024-03-01 12:00:00";
  private static final String T2 = "2024-03-01 12:05:00";

  @TempDir
  Path tempDir;

  private Database database;
  private DeviceDao deviceDao;

  @BeforeEach
  void setUp() {
    database = new Database(tempDir.resolve("simhub.sql"));
    database.open();
    deviceDao = new DeviceDao(database);
  }

  @AfterEach
  void tearDown() {
    database.close();
  }

  @Test
  @DisplayName("upsertNetworkState создаёт устройство, затем обновляет ту же строку")
  void shouldUpsertNetworkState() {
    assertThat(deviceDao.upsertNetworkState("gw_1", "10.0.0.1", "home", -50, "v1", T1)).isTrue();
    assertThat(deviceDao.upsertNetworkState("gw_1", "10.0.0.2", "office", -65, "v1", T2)).isTrue();

    Device device = deviceDao.getDeviceById("gw_1");
    assertThat(deviceDao.countDevices("gw_1")).isEqualTo(1);
    assertThat(device.getLastIp()).isEqualTo("10.0.0.2");
    assertThat(device.getLastSsid()).isEqualTo("office");
    assertThat(device.getLastSignalLevel()).isEqualTo(-65);
    assertThat(device.getCreatedAt()).isEqualTo(T1);
    assertThat(device.getLastSeenAt()).isEqualTo(T2);
  }

  @Test
  @DisplayName("ensureDevice не создаёт дубликат")
  void shouldEnsureDeviceOnce() {
    assertThat(deviceDao.ensureDevice("gw_2", T1)).isTrue();
    assertThat(deviceDao.ensureDevice("gw_2", T2)).isTrue();

    assertThat(deviceDao.countDevices("gw_2")).isEqualTo(1);
    assertThat(deviceDao.getDeviceById("gw_2").getCreatedAt()).isEqualTo(T1);
  }

  @Test
  @DisplayName("Прямая вставка существующего devId отклоняется уникальным индексом")
  void shouldRejectDuplicateInsert() {
    assertThat(deviceDao.createDevice("gw_3", T1)).isTrue();
    assertThat(deviceDao.createDevice("gw_3", T2)).isFalse();
  }

  @Test
  @DisplayName("touch возвращает offline-устройство в online")
  void shouldTouchDevice() {
    deviceDao.createDevice("gw_4", T1);
    deviceDao.markOfflineBefore(T2, T2);
    assertThat(deviceDao.getDeviceById("gw_4").getStatus()).isEqualTo(DeviceStatus.OFFLINE);

    assertThat(deviceDao.touch("gw_4", T2)).isTrue();

    assertThat(deviceDao.getDeviceById("gw_4").getStatus()).isEqualTo(DeviceStatus.ONLINE);
    assertThat(deviceDao.touch("gw_missing", T2)).isFalse();
  }

  @Test
  @DisplayName("Переименование и список устройств")
  void shouldRenameAndListDevices() {
    deviceDao.createDevice("gw_b", T1);
    deviceDao.createDevice("gw_a", T1);

    assertThat(deviceDao.rename("gw_a", "Lobby", T2)).isTrue();

    assertThat(deviceDao.getAllDevices()).extracting(Device::getDevId).containsExactly("gw_a", "gw_b");
    assertThat(deviceDao.getDeviceById("gw_a").getName()).isEqualTo("Lobby");
    assertThat(deviceDao.rename("gw_missing", "x", T2)).isFalse();
  }

  @Test
  @DisplayName("Удаление устройства удаляет SIM-карты, журналы SMS, звонков и сообщений")
  void shouldCascadeDelete() {
    deviceDao.createDevice("gw_del", T1);
    deviceDao.createDevice("gw_keep", T1);
    SimCardDao simCardDao = new SimCardDao(database);
    simCardDao.upsertSimCard("gw_del", 1, "8986", "460", "", null, "", "ready", T1);
    new MessageDao(database).saveMessage("gw_del", 998, "Heartbeat PING", "{}", T1);
    new SmsRecordDao(database).saveSms(new SmsRecord("gw_del", 1, "100", "hi", T1, SmsRecord.DIRECTION_IN, T1));
    new CallRecordDao(database).saveCall(new CallRecord("gw_del", 1, "100", 601, "Incoming call ringing", T1, 0, T1));
    new SmsRecordDao(database).saveSms(new SmsRecord("gw_keep", 1, "100", "hi", T1, SmsRecord.DIRECTION_IN, T1));

    assertThat(deviceDao.deleteDevice("gw_del")).isTrue();

    assertThat(deviceDao.exists("gw_del")).isFalse();
    assertThat(simCardDao.getSimCards("gw_del")).isEmpty();
    assertThat(new MessageDao(database).getMessages("gw_del")).isEmpty();
    assertThat(new SmsRecordDao(database).getSmsByDevice("gw_del")).isEmpty();
    assertThat(new CallRecordDao(database).getCallsByDevice("gw_del")).isEmpty();
    assertThat(new SmsRecordDao(database).getSmsByDevice("gw_keep")).hasSize(1);
    assertThat(deviceDao.deleteDevice("gw_del")).isFalse();
  }
}
