package lockerhub.jdbc;

import lockerhub.CommandQueue;
import lockerhub.EventLog;
import lockerhub.IllegalTransitionException;
import lockerhub.LockerRepository;
import lockerhub.OptimisticLockException;
import lockerhub.ValidationException;
import lockerhub.model.Command;
import lockerhub.model.CommandRequest;
import lockerhub.model.CommandType;
import lockerhub.model.EventType;
import lockerhub.model.Locker;
import lockerhub.model.LockerFilter;
import lockerhub.model.LockerKey;
import lockerhub.model.LockerStatus;
import lockerhub.model.LockerUpdate;
import lockerhub.model.NewEvent;
import lockerhub.model.Owner;
import lockerhub.model.OwnerType;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Locker state transitions used by kiosks and staff.
 *
 * <p>Each transition reads the locker, checks that it may move, applies a versioned
 * update and appends its audit event in one transaction. A lost race
 * ({@link OptimisticLockException}) re-reads and retries up to {@code maxAttempts}
 * times before the exception reaches the caller.
 *
 * <pre>
 *   Free --assign--> Reserved --confirmOwnership--> Owned --markOpening--> Opening
 *     ^                 |                             |                      |
 *     +-----------------+-----------release-----------+----------------------+
 *   any --block--> Blocked --unblock--> Free
 *   any --reportHardwareError--> Error --resolveError--> Free
 * </pre>
 */
public final class LockerOperations {
  private static final Logger logger = Logger.getLogger(LockerOperations.class.getName());

  public static final int DEFAULT_MAX_ATTEMPTS = 3;
  private static final int OWNER_LOCK_STRIPES = 256;

  private final DatabaseManager db;
  private final LockerRepository lockers;
  private final CommandQueue commands;
  private final EventLog events;
  private final Clock clock;
  private final int maxAttempts;
  private final int commandMaxRetries;
  private final Lock[] ownerLocks = new Lock[OWNER_LOCK_STRIPES];

  private LockerOperations(Builder builder) {
    this.db = Objects.requireNonNull(builder.db, "db");
    this.lockers = Objects.requireNonNull(builder.lockers, "lockers");
    this.commands = Objects.requireNonNull(builder.commands, "commands");
    this.events = Objects.requireNonNull(builder.events, "events");
    this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
    if (builder.maxAttempts <= 0) {
      throw new IllegalArgumentException("maxAttempts must be > 0, got: " + builder.maxAttempts);
    }
    this.maxAttempts = builder.maxAttempts;
    if (builder.commandMaxRetries < 0) {
      throw new IllegalArgumentException(
          "commandMaxRetries must be >= 0, got: " + builder.commandMaxRetries);
    }
    this.commandMaxRetries = builder.commandMaxRetries;
    for (int i = 0; i < ownerLocks.length; i++) {
      ownerLocks[i] = new ReentrantLock();
    }
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Reserves a free, non-VIP locker for {@code owner}. A card or device may hold only one
   * locker at a time; VIP lockers are opened through their contract and never assigned.
   *
   * <p>Assignments of the same owner key are serialized within this instance until the
   * enclosing transaction ends, so two kiosk threads cannot hand one card two lockers.
   * Writers in other processes sharing the database are only checked against committed
   * rows.
   *
   * @throws ValidationException if the owner already holds a locker or the locker is VIP
   * @throws IllegalTransitionException if the locker is not free
   */
  public Locker assign(String kioskId, int lockerId, Owner owner) {
    Objects.requireNonNull(owner, "owner");
    if (owner.type() == OwnerType.VIP) {
      throw new ValidationException("VIP contracts are not assigned through kiosk reservations");
    }
    Lock ownerLock = ownerLocks[Math.floorMod(owner.key().hashCode(), ownerLocks.length)];
    ownerLock.lock();
    boolean handedOff = false;
    try {
      Locker assigned = transition(LockerKey.of(kioskId, lockerId), locker -> {
        requireStatus(locker, LockerStatus.RESERVED, LockerStatus.FREE);
        if (locker.vip()) {
          throw new ValidationException("Locker " + locker.key() + " is reserved for a VIP contract");
        }
        for (Locker held : lockers.findAll(LockerFilter.all().withOwnerKey(owner.key()))) {
          if (held.status().isHeld() && !held.key().equals(locker.key())) {
            throw new ValidationException(owner.type().code() + " " + owner.key()
                + " already holds locker " + held.key());
          }
        }
        Locker updated = lockers.update(locker.key(), LockerUpdate.builder()
            .status(LockerStatus.RESERVED)
            .owner(owner)
            .reservedAt(now())
            .ownedAt(null)
            .build(), locker.version());
        log(ownerEvent(owner, true), updated, owner, null, Map.of());
        return updated;
      });
      // held until a caller's transaction commits or rolls back; released now otherwise
      db.afterCompletion(ownerLock::unlock);
      handedOff = true;
      return assigned;
    } finally {
      if (!handedOff) {
        ownerLock.unlock();
      }
    }
  }

  public Locker confirmOwnership(String kioskId, int lockerId) {
    return transition(LockerKey.of(kioskId, lockerId), locker -> {
      requireStatus(locker, LockerStatus.OWNED, LockerStatus.RESERVED);
      return lockers.update(locker.key(), LockerUpdate.builder()
          .status(LockerStatus.OWNED)
          .ownedAt(now())
          .build(), locker.version());
    });
  }

  public Locker markOpening(String kioskId, int lockerId) {
    return transition(LockerKey.of(kioskId, lockerId), locker -> {
      requireStatus(locker, LockerStatus.OPENING, LockerStatus.OWNED);
      return lockers.update(locker.key(),
          LockerUpdate.builder().status(LockerStatus.OPENING).build(), locker.version());
    });
  }

  /**
   * Frees a held locker.
   *
   * @param ownerKey when given, must match the current holder
   */
  public Locker release(String kioskId, int lockerId, String ownerKey) {
    return transition(LockerKey.of(kioskId, lockerId), locker -> {
      requireStatus(locker, LockerStatus.FREE, LockerStatus.RESERVED, LockerStatus.OWNED, LockerStatus.OPENING);
      if (ownerKey != null && !locker.isOwnedBy(ownerKey)) {
        throw new ValidationException("Locker " + locker.key() + " is not held by " + ownerKey);
      }
      Owner owner = locker.owner();
      Locker updated = lockers.update(locker.key(),
          LockerUpdate.builder().status(LockerStatus.FREE).clearOwner().build(), locker.version());
      if (owner != null) {
        log(ownerEvent(owner, false), updated, owner, null,
            Map.of("previous_status", locker.status().code()));
      }
      return updated;
    });
  }

  public Locker block(String kioskId, int lockerId, String staffUser, String reason) {
    requireStaff(staffUser);
    return transition(LockerKey.of(kioskId, lockerId), locker -> {
      if (locker.status() == LockerStatus.BLOCKED) {
        throw new IllegalTransitionException("Locker", locker.key(), locker.status().code(),
            LockerStatus.BLOCKED.code());
      }
      Locker updated = lockers.update(locker.key(),
          LockerUpdate.builder().status(LockerStatus.BLOCKED).build(), locker.version());
      Map<String, Object> details = new LinkedHashMap<>();
      details.put("reason", reason);
      details.put("previous_status", locker.status().code());
      log(EventType.STAFF_BLOCK, updated, null, staffUser, details);
      return updated;
    });
  }

  public Locker unblock(String kioskId, int lockerId, String staffUser) {
    requireStaff(staffUser);
    return transition(LockerKey.of(kioskId, lockerId), locker -> {
      requireStatus(locker, LockerStatus.FREE, LockerStatus.BLOCKED);
      Locker updated = lockers.update(locker.key(),
          LockerUpdate.builder().status(LockerStatus.FREE).clearOwner().build(), locker.version());
      log(EventType.STAFF_UNBLOCK, updated, null, staffUser, Map.of());
      return updated;
    });
  }

  public Locker reportHardwareError(String kioskId, int lockerId, String error) {
    return transition(LockerKey.of(kioskId, lockerId), locker -> {
      Locker updated = lockers.update(locker.key(),
          LockerUpdate.builder().status(LockerStatus.ERROR).clearOwner().build(), locker.version());
      Map<String, Object> details = new LinkedHashMap<>();
      details.put("error", error);
      details.put("previous_status", locker.status().code());
      log(EventType.HARDWARE_ERROR, updated, null, null, details);
      return updated;
    });
  }

  /**
   * @param staffUser who cleared the fault, or {@code null} when the kiosk recovered on its own
   */
  public Locker resolveError(String kioskId, int lockerId, String staffUser) {
    return transition(LockerKey.of(kioskId, lockerId), locker -> {
      requireStatus(locker, LockerStatus.FREE, LockerStatus.ERROR);
      Locker updated = lockers.update(locker.key(),
          LockerUpdate.builder().status(LockerStatus.FREE).build(), locker.version());
      log(EventType.ERROR_RESOLVED, updated, null, staffUser, Map.of());
      return updated;
    });
  }

  public Locker rename(String kioskId, int lockerId, String displayName, String updatedBy) {
    return transition(LockerKey.of(kioskId, lockerId), locker -> lockers.update(locker.key(),
        LockerUpdate.builder().displayName(displayName, updatedBy).build(), locker.version()));
  }

  /**
   * Queues an {@code open_locker} command and records who asked for it. The locker
   * state is left to the kiosk to report.
   */
  public Command staffOpen(String kioskId, int lockerId, String staffUser, String reason) {
    requireStaff(staffUser);
    return db.inTransaction(() -> {
      Locker locker = lockers.getById(LockerKey.of(kioskId, lockerId));
      Map<String, Object> payload = new LinkedHashMap<>();
      payload.put("locker_id", lockerId);
      payload.put("staff_user", staffUser);
      payload.put("reason", reason);
      Command command = commands.enqueue(command(kioskId, CommandType.OPEN_LOCKER, payload));
      Map<String, Object> details = new LinkedHashMap<>();
      details.put("reason", reason);
      details.put("command_id", command.commandId());
      log(EventType.STAFF_OPEN, locker, null, staffUser, details);
      return command;
    });
  }

  /**
   * Queues one {@code bulk_open} command for several lockers of a kiosk.
   *
   * @param excludeVip skip lockers reserved for VIP contracts
   */
  public Command bulkOpen(String kioskId, List<Integer> lockerIds, String staffUser, boolean excludeVip) {
    requireStaff(staffUser);
    Objects.requireNonNull(lockerIds, "lockerIds");
    return db.inTransaction(() -> {
      List<Integer> targets = new ArrayList<>();
      for (Integer lockerId : lockerIds) {
        Optional<Locker> locker = lockers.findByKioskAndId(kioskId, lockerId);
        if (locker.isEmpty() || (excludeVip && locker.get().vip())) {
          continue;
        }
        targets.add(lockerId);
      }
      if (targets.isEmpty()) {
        throw new ValidationException("No lockers to open on kiosk " + kioskId);
      }
      Map<String, Object> payload = new LinkedHashMap<>();
      payload.put("locker_ids", targets);
      payload.put("staff_user", staffUser);
      payload.put("exclude_vip", excludeVip);
      Command command = commands.enqueue(command(kioskId, CommandType.BULK_OPEN, payload));
      events.create(NewEvent.builder(EventType.BULK_OPEN, kioskId)
          .staffUser(staffUser)
          .detail("locker_ids", targets)
          .detail("count", targets.size())
          .detail("exclude_vip", excludeVip)
          .detail("command_id", command.commandId())
          .build());
      logger.log(Level.INFO, "{0} queued bulk open of {1} lockers on kiosk {2}",
          new Object[]{staffUser, targets.size(), kioskId});
      return command;
    });
  }

  private Locker transition(LockerKey key, Function<Locker, Locker> step) {
    for (int attempt = 1; ; attempt++) {
      try {
        return db.inTransaction(() -> step.apply(lockers.getById(key)));
      } catch (OptimisticLockException e) {
        if (attempt >= maxAttempts) {
          throw e;
        }
        logger.log(Level.FINE, "Locker {0} changed concurrently (attempt {1} of {2}), retrying",
            new Object[]{key, attempt, maxAttempts});
      }
    }
  }

  private static void requireStatus(Locker locker, LockerStatus target, LockerStatus... allowed) {
    for (LockerStatus status : allowed) {
      if (locker.status() == status) {
        return;
      }
    }
    throw new IllegalTransitionException("Locker", locker.key(), locker.status().code(), target.code());
  }

  private static void requireStaff(String staffUser) {
    if (staffUser == null || staffUser.isBlank()) {
      throw new ValidationException("Staff actions require a staff user");
    }
  }

  private static EventType ownerEvent(Owner owner, boolean assign) {
    if (owner.type() == OwnerType.DEVICE) {
      return assign ? EventType.QR_ASSIGN : EventType.QR_RELEASE;
    }
    return assign ? EventType.RFID_ASSIGN : EventType.RFID_RELEASE;
  }

  private void log(EventType type, Locker locker, Owner owner, String staffUser, Map<String, Object> details) {
    NewEvent.Builder event = NewEvent.builder(type, locker.kioskId())
        .lockerId(locker.id())
        .staffUser(staffUser)
        .details(details);
    if (owner != null && owner.type() == OwnerType.DEVICE) {
      event.deviceId(owner.key());
    } else if (owner != null) {
      event.rfidCard(owner.key());
    }
    events.create(event.build());
  }

  private Instant now() {
    return clock.instant();
  }

  private CommandRequest command(String kioskId, CommandType type, Map<String, Object> payload) {
    return CommandRequest.builder(kioskId, type)
        .payload(payload)
        .maxRetries(commandMaxRetries)
        .build();
  }

  /** Builder for {@link LockerOperations}. */
  public static final class Builder {
    private DatabaseManager db;
    private LockerRepository lockers;
    private CommandQueue commands;
    private EventLog events;
    private Clock clock;
    private int maxAttempts = DEFAULT_MAX_ATTEMPTS;
    private int commandMaxRetries = CommandRequest.DEFAULT_MAX_RETRIES;

    private Builder() {}

    public Builder db(DatabaseManager db) {
      this.db = db;
      return this;
    }

    public Builder lockers(LockerRepository lockers) {
      this.lockers = lockers;
      return this;
    }

    public Builder commands(CommandQueue commands) {
      this.commands = commands;
      return this;
    }

    public Builder events(EventLog events) {
      this.events = events;
      return this;
    }

    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    /** Attempts per transition when the locker changes concurrently. Defaults to {@code 3}. */
    public Builder maxAttempts(int maxAttempts) {
      this.maxAttempts = maxAttempts;
      return this;
    }

    /** Retry budget of the commands queued by staff opens. */
    public Builder commandMaxRetries(int commandMaxRetries) {
      this.commandMaxRetries = commandMaxRetries;
      return this;
    }

    public LockerOperations build() {
      return new LockerOperations(this);
    }
  }
}
