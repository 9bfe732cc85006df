package lockerhub.jdbc.store;

import lockerhub.VipHistoryRepository;
import lockerhub.jdbc.H2Databases;
import lockerhub.jdbc.LockerHub;
import lockerhub.jdbc.MutableClock;
import lockerhub.model.NewVipHistoryEntry;
import lockerhub.model.VipHistoryAction;
import lockerhub.model.VipHistoryEntry;
import lockerhub.model.VipHistoryFilter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class JdbcVipHistoryRepositoryTest {

  private MutableClock clock;
  private VipHistoryRepository history;

  @BeforeEach
  void setUp() {
    clock = MutableClock.startingAt("2024-03-01T10:00:00Z");
    history = LockerHub.builder()
        .dataSource(H2Databases.newDataSource())
        .clock(clock)
        .build()
        .history();
  }

  @Test
  void logActionStoresJsonValues() {
    VipHistoryEntry logged = history.logAction(new NewVipHistoryEntry(1L, VipHistoryAction.EXTENDED, "alice",
        Map.of("end_date", "2024-04-01"), Map.of("end_date", "2024-05-01"), "renewal",
        Map.of("extension_days", 30)));

    VipHistoryEntry stored = history.getContractHistory(1L).get(0);
    assertEquals(logged.id(), stored.id());
    assertEquals(clock.instant(), stored.timestamp());
    assertEquals("2024-04-01", stored.oldValues().get("end_date"));
    assertEquals("2024-05-01", stored.newValues().get("end_date"));
    assertEquals(30, stored.details().get("extension_days"));
    assertEquals("renewal", stored.reason());
  }

  @Test
  void entriesWithoutValuesReadBackEmpty() {
    history.logAction(NewVipHistoryEntry.of(2L, VipHistoryAction.CANCELLED, "bob", null));

    VipHistoryEntry stored = history.getContractHistory(2L).get(0);
    assertTrue(stored.oldValues().isEmpty());
    assertTrue(stored.details().isEmpty());
    assertNull(stored.reason());
  }

  @Test
  void contractHistoryIsNewestFirst() {
    history.logAction(NewVipHistoryEntry.of(1L, VipHistoryAction.CREATED, "alice", null));
    clock.advance(Duration.ofMinutes(1));
    history.logAction(NewVipHistoryEntry.of(1L, VipHistoryAction.EXTENDED, "alice", null));
    history.logAction(NewVipHistoryEntry.of(2L, VipHistoryAction.CREATED, "alice", null));

    List<VipHistoryEntry> entries = history.getContractHistory(1L);
    assertEquals(List.of(VipHistoryAction.EXTENDED, VipHistoryAction.CREATED),
        entries.stream().map(VipHistoryEntry::action).toList());
  }

  @Test
  void staffAuditTrailIsBoundedByTime() {
    Instant start = clock.instant();
    history.logAction(NewVipHistoryEntry.of(1L, VipHistoryAction.CREATED, "alice", null));
    clock.advance(Duration.ofHours(2));
    history.logAction(NewVipHistoryEntry.of(1L, VipHistoryAction.EXTENDED, "alice", null));
    history.logAction(NewVipHistoryEntry.of(1L, VipHistoryAction.CARD_CHANGED, "bob", null));

    assertEquals(2, history.getStaffAuditTrail("alice", null, null).size());
    assertEquals(1, history.getStaffAuditTrail("alice", start, start.plusSeconds(60)).size());
    assertEquals(1, history.findAll(VipHistoryFilter.all().withAction(VipHistoryAction.CARD_CHANGED)).size());
  }

  @Test
  void recentActionsAreLimited() {
    for (int i = 0; i < 5; i++) {
      history.logAction(NewVipHistoryEntry.of(i, VipHistoryAction.CREATED, "alice", null));
    }

    List<VipHistoryEntry> recent = history.getRecentActions(3);
    assertEquals(3, recent.size());
    assertEquals(4L, recent.get(0).contractId());
    assertThrows(IllegalArgumentException.class, () -> history.getRecentActions(0));
  }

  @Test
  void cleanupDropsEntriesPastRetention() {
    history.logAction(NewVipHistoryEntry.of(1L, VipHistoryAction.CREATED, "alice", null));
    clock.advance(Duration.ofDays(366));
    history.logAction(NewVipHistoryEntry.of(1L, VipHistoryAction.EXTENDED, "alice", null));

    assertEquals(1, history.cleanupOldHistory());
    assertEquals(1, history.getContractHistory(1L).size());
  }
}
