package lockerhub.jdbc.store;

import lockerhub.EventLog;
import lockerhub.ValidationException;
import lockerhub.jdbc.H2Databases;
import lockerhub.jdbc.LockerHub;
import lockerhub.jdbc.MutableClock;
import lockerhub.model.Event;
import lockerhub.model.EventCategory;
import lockerhub.model.EventFilter;
import lockerhub.model.EventStatistics;
import lockerhub.model.EventType;
import lockerhub.model.NewEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class JdbcEventLogTest {

  private MutableClock clock;
  private DataSource dataSource;
  private EventLog events;

  @BeforeEach
  void setUp() {
    clock = MutableClock.startingAt("2024-03-01T10:00:00Z");
    dataSource = H2Databases.newDataSource();
    events = LockerHub.builder()
        .dataSource(dataSource)
        .clock(clock)
        .build()
        .events();
  }

  @Test
  void createPersistsAllFields() {
    Event created = events.create(NewEvent.builder(EventType.STAFF_OPEN, "K1")
        .lockerId(5)
        .staffUser("admin")
        .detail("reason", "lost card")
        .detail("attempt", 2)
        .build());

    Event stored = events.findById(created.id()).orElseThrow();
    assertEquals(clock.instant(), stored.timestamp());
    assertEquals("K1", stored.kioskId());
    assertEquals(5, stored.lockerId());
    assertEquals(EventType.STAFF_OPEN, stored.type());
    assertEquals("admin", stored.staffUser());
    assertEquals(Map.of("reason", "lost card", "attempt", 2), stored.details());
    assertEquals(EventCategory.STAFF, stored.category());
  }

  @Test
  void staffEventWithoutStaffUserNeverReachesStorage() {
    assertThrows(ValidationException.class, () -> events.logEvent("K1", 5, EventType.STAFF_BLOCK, null));

    assertEquals(0, events.count(EventFilter.all()));
  }

  @Test
  void logEventStoresKioskLevelEvents() {
    Event event = events.logEvent("K1", null, EventType.RESTARTED, Map.of("reason", "power"));

    Event stored = events.findById(event.id()).orElseThrow();
    assertNull(stored.lockerId());
    assertEquals(EventCategory.SYSTEM, stored.category());
  }

  @Test
  void findAllIsNewestFirstWithPaging() {
    for (int i = 1; i <= 5; i++) {
      events.logEvent("K1", i, EventType.RFID_ASSIGN, null);
      clock.advance(Duration.ofSeconds(1));
    }

    List<Event> page = events.findAll(EventFilter.builder().kioskId("K1").limit(2).offset(1).build());

    assertEquals(2, page.size());
    assertEquals(4, page.get(0).lockerId());
    assertEquals(3, page.get(1).lockerId());
    assertEquals(5, events.findRecent().size());
    assertEquals(1, events.findByLocker("K1", 2, 10).size());
  }

  @Test
  void dateRangeIsInclusiveAndAscending() {
    Instant start = clock.instant();
    events.logEvent("K1", 1, EventType.RFID_ASSIGN, null);
    clock.advance(Duration.ofMinutes(1));
    events.logEvent("K1", 2, EventType.RFID_ASSIGN, null);
    clock.advance(Duration.ofMinutes(1));
    events.logEvent("K1", 3, EventType.RFID_ASSIGN, null);

    List<Event> range = events.findByDateRange(start, start.plus(Duration.ofMinutes(1)));

    assertEquals(2, range.size());
    assertEquals(1, range.get(0).lockerId());
    assertEquals(2, range.get(1).lockerId());
  }

  @Test
  void staffActionsIncludeOnlyAuditedTypes() {
    events.create(NewEvent.builder(EventType.STAFF_BLOCK, "K1").lockerId(1).staffUser("alice").build());
    events.create(NewEvent.builder(EventType.RFID_RELEASE, "K1").lockerId(2).staffUser("bob").build());
    events.logEvent("K1", 3, EventType.BULK_OPEN, null);
    events.logEvent("K1", 4, EventType.RFID_ASSIGN, null);

    List<Event> actions = events.findStaffActions(null, null, null);
    assertEquals(2, actions.size());
    assertTrue(actions.stream().allMatch(e -> EventType.staffAudited().contains(e.type())));
    assertEquals(1, events.findStaffActions("alice", null, null).size());
    assertTrue(events.findStaffActions("bob", null, null).isEmpty());
  }

  @Test
  void resolvedErrorIsNotAStaffAction() {
    events.logEvent("K1", 1, EventType.HARDWARE_ERROR, Map.of("code", "E42"));
    events.create(NewEvent.builder(EventType.ERROR_RESOLVED, "K1").lockerId(1).staffUser("admin").build());

    assertTrue(events.findStaffActions(null, null, null).isEmpty());
    assertTrue(events.findStaffActions("admin", null, null).isEmpty());
    assertEquals(EventCategory.STAFF, events.findRecent().stream()
        .filter(e -> e.type() == EventType.ERROR_RESOLVED).findFirst().orElseThrow().category());
  }

  @Test
  void unknownStoredTypesAreReadBack() throws SQLException {
    insertRaw("staff_release", "ops");
    insertRaw("system_boot", null);
    events.logEvent("K1", 2, EventType.RFID_ASSIGN, null);

    List<Event> stored = events.findRecent();
    assertEquals(3, stored.size());
    Event release = stored.stream().filter(e -> "staff_release".equals(e.typeCode())).findFirst().orElseThrow();
    assertEquals(EventType.OTHER, release.type());
    assertEquals(EventCategory.STAFF, release.category());
    Event boot = stored.stream().filter(e -> "system_boot".equals(e.typeCode())).findFirst().orElseThrow();
    assertEquals(EventCategory.SYSTEM, boot.category());

    EventStatistics stats = events.getStatistics(null, null);
    assertEquals(3, stats.total());
    assertEquals(2, stats.count(EventType.OTHER));
    assertEquals(1, stats.count(EventCategory.SYSTEM));
    assertEquals(1, stats.count(EventCategory.STAFF));
    assertEquals(1, stats.count(EventCategory.USER));
  }

  private void insertRaw(String eventType, String staffUser) throws SQLException {
    try (Connection conn = dataSource.getConnection();
         PreparedStatement ps = conn.prepareStatement(
             "INSERT INTO events (timestamp, kiosk_id, locker_id, event_type, staff_user) VALUES (?,?,?,?,?)")) {
      ps.setTimestamp(1, Timestamp.from(clock.instant()));
      ps.setString(2, "K1");
      ps.setInt(3, 1);
      ps.setString(4, eventType);
      ps.setString(5, staffUser);
      ps.executeUpdate();
    }
  }

  @Test
  void statisticsGroupByTypeKioskAndCategory() {
    events.logEvent("K1", 1, EventType.RFID_ASSIGN, null);
    events.logEvent("K1", 1, EventType.RFID_RELEASE, null);
    events.logEvent("K2", null, EventType.RESTARTED, null);
    events.create(NewEvent.builder(EventType.STAFF_OPEN, "K2").lockerId(1).staffUser("admin").build());

    EventStatistics stats = events.getStatistics(null, null);

    assertEquals(4, stats.total());
    assertEquals(1, stats.count(EventType.RFID_ASSIGN));
    assertEquals(2, stats.byKiosk().get("K1"));
    assertEquals(2, stats.count(EventCategory.USER));
    assertEquals(1, stats.count(EventCategory.SYSTEM));
    assertEquals(1, stats.count(EventCategory.STAFF));
  }

  @Test
  void cleanupRemovesEventsOlderThanRetention() {
    events.logEvent("K1", 1, EventType.RFID_ASSIGN, null);
    clock.advance(Duration.ofDays(31));
    events.logEvent("K1", 2, EventType.RFID_ASSIGN, null);

    assertEquals(1, events.cleanupOldEvents());
    assertEquals(0, events.cleanupOldEvents());
    assertEquals(1, events.count(EventFilter.all()));
  }
}
