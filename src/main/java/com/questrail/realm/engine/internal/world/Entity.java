package com.questrail.realm.engine.internal.world;

import com.questrail.realm.api.EntityId;
import com.questrail.realm.api.RoomId;
import com.questrail.realm.engine.internal.combat.CombatState;
import com.questrail.realm.engine.internal.effects.Effect;
import com.questrail.realm.engine.internal.effects.EffectId;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Entity
 * -----------------------------------------------------------------------------
 * A participant or NPC living in the {@link World} arena.
 *
 * <h2>Ownership</h2>
 * Entities are mutable and owned by the engine loop. Only code running inside a
 * unit of work may call the mutators. The current room is held as an id and
 * resolved through the world on every use.
 *
 * <h2>Effective stats</h2>
 * {@link #effectiveStat(Stat)} is always derived: base value plus the modifiers
 * of the currently active effects. Nothing caches it, so removing an effect
 * restores the pre-application value exactly.
 */
public final class Entity
{
    private final EntityId id;
    private final EntityKind kind;
    private final String name;
    private final List<String> keywords;
    private final StatBlock stats;
    private final WeaponStats naturalWeapon;
    private final RoomId homeRoom;
    private final CombatState combat;
    private final int experienceReward;

    private final Map<String, WeaponStats> carried = new LinkedHashMap<>();
    private final Map<EffectId, Effect> effects = new LinkedHashMap<>();

    private RoomId roomId;
    private int currentHealth;
    private WeaponStats equipped;
    private boolean connected;
    private long experience;

    private Entity(Builder b) {
        this.id = b.id;
        this.kind = b.kind;
        this.name = b.name;
        this.keywords = List.copyOf(b.keywords);
        this.stats = b.stats;
        this.naturalWeapon = b.naturalWeapon;
        this.homeRoom = b.room;
        this.roomId = b.room;
        this.currentHealth = b.currentHealth == null ? b.stats.maxHealth() : b.currentHealth;
        this.combat = new CombatState(b.id);
        this.experienceReward = b.experienceReward;
        this.experience = b.experience;
        for (WeaponStats w : b.carried) {
            carry(w);
        }
    }

    public EntityId id() {
        return id;
    }

    public EntityKind kind() {
        return kind;
    }

    public boolean isParticipant() {
        return kind == EntityKind.PARTICIPANT;
    }

    public String name() {
        return name;
    }

    public StatBlock stats() {
        return stats;
    }

    /**
     * Current room, or empty while the entity is out of the world (a slain NPC
     * waiting to respawn).
     */
    public Optional<RoomId> room() {
        return Optional.ofNullable(roomId);
    }

    public RoomId homeRoom() {
        return homeRoom;
    }

    public CombatState combat() {
        return combat;
    }

    public boolean isConnected() {
        return connected;
    }

    public void setConnected(boolean connected) {
        this.connected = connected;
    }

    // ---------------------------------------------------------------------
    // Health
    // ---------------------------------------------------------------------

    public int currentHealth() {
        return currentHealth;
    }

    public int maxHealth() {
        return stats.maxHealth();
    }

    public boolean isAlive() {
        return currentHealth > 0;
    }

    /**
     * Applies damage, flooring health at {@code floor}.
     *
     * @return the amount of health actually lost
     */
    public int damage(int amount, int floor) {
        int before = currentHealth;
        currentHealth = Math.max(floor, currentHealth - Math.max(0, amount));
        return Math.max(0, before - currentHealth);
    }

    /**
     * Heals up to max health.
     *
     * @return the amount of health actually gained
     */
    public int heal(int amount) {
        int before = currentHealth;
        currentHealth = Math.min(stats.maxHealth(), currentHealth + Math.max(0, amount));
        return currentHealth - before;
    }

    public void restoreFullHealth() {
        currentHealth = stats.maxHealth();
    }

    // ---------------------------------------------------------------------
    // Weapons
    // ---------------------------------------------------------------------

    /**
     * The weapon combat would snapshot right now: the equipped weapon, or the
     * natural attack.
     */
    public WeaponStats weapon() {
        return equipped != null ? equipped : naturalWeapon;
    }

    public Optional<WeaponStats> equipped() {
        return Optional.ofNullable(equipped);
    }

    public void carry(WeaponStats weapon) {
        Objects.requireNonNull(weapon, "weapon");
        carried.put(weapon.name().toLowerCase(Locale.ROOT), weapon);
    }

    public Optional<WeaponStats> findCarried(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String needle = name.trim().toLowerCase(Locale.ROOT);
        WeaponStats exact = carried.get(needle);
        if (exact != null) {
            return Optional.of(exact);
        }
        return carried.entrySet().stream()
                .filter(e -> e.getKey().contains(needle))
                .map(Map.Entry::getValue)
                .findFirst();
    }

    public void equip(WeaponStats weapon) {
        this.equipped = Objects.requireNonNull(weapon, "weapon");
    }

    public void unequip() {
        this.equipped = null;
    }

    // ---------------------------------------------------------------------
    // Effects
    // ---------------------------------------------------------------------

    public int effectiveStat(Stat stat) {
        int total = stats.base(stat);
        for (Effect effect : effects.values()) {
            total += effect.modifier(stat);
        }
        return total;
    }

    public void addEffect(Effect effect) {
        effects.put(effect.id(), effect);
    }

    public Optional<Effect> effect(EffectId effectId) {
        return Optional.ofNullable(effects.get(effectId));
    }

    public Optional<Effect> removeEffect(EffectId effectId) {
        return Optional.ofNullable(effects.remove(effectId));
    }

    public Collection<Effect> effects() {
        return Collections.unmodifiableCollection(effects.values());
    }

    // ---------------------------------------------------------------------
    // Targeting
    // ---------------------------------------------------------------------

    /**
     * Case-insensitive match on exact keyword, or substring of the name.
     */
    public boolean matches(String search) {
        if (search == null || search.isBlank()) {
            return false;
        }
        String s = search.trim().toLowerCase(Locale.ROOT);
        if (name.toLowerCase(Locale.ROOT).contains(s)) {
            return true;
        }
        for (String keyword : keywords) {
            if (keyword.equalsIgnoreCase(s)) {
                return true;
            }
        }
        return false;
    }

    // Placement is owned by World so that room occupancy stays consistent.
    void placeIn(RoomId room) {
        this.roomId = room;
    }

    // ---------------------------------------------------------------------
    // Experience
    // ---------------------------------------------------------------------

    /**
     * Experience awarded to the participant that slays this entity.
     */
    public int experienceReward() {
        return experienceReward;
    }

    public long experience() {
        return experience;
    }

    public void gainExperience(int amount) {
        if (amount < 0) {
            throw new IllegalArgumentException("amount must be >= 0");
        }
        experience += amount;
    }

    @Override
    public String toString() {
        return kind + "(" + id + ", " + name + ")";
    }

    // ---------------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------------

    public static Builder participant(EntityId id, String name) {
        return new Builder(id, EntityKind.PARTICIPANT, name);
    }

    public static Builder npc(EntityId id, String name) {
        return new Builder(id, EntityKind.NPC, name);
    }

    public static final class Builder {
        private final EntityId id;
        private final EntityKind kind;
        private final String name;
        private final List<String> keywords = new ArrayList<>();
        private final List<WeaponStats> carried = new ArrayList<>();
        private StatBlock stats = StatBlock.defaults();
        private WeaponStats naturalWeapon = WeaponStats.unarmed();
        private RoomId room;
        private Integer currentHealth;
        private int experienceReward;
        private long experience;

        private Builder(EntityId id, EntityKind kind, String name) {
            this.id = Objects.requireNonNull(id, "id");
            this.kind = Objects.requireNonNull(kind, "kind");
            this.name = Objects.requireNonNull(name, "name");
        }

        public Builder keywords(String... values) {
            keywords.addAll(List.of(values));
            return this;
        }

        public Builder stats(StatBlock stats) {
            this.stats = Objects.requireNonNull(stats, "stats");
            return this;
        }

        public Builder naturalWeapon(WeaponStats weapon) {
            this.naturalWeapon = Objects.requireNonNull(weapon, "weapon");
            return this;
        }

        public Builder carrying(WeaponStats weapon) {
            carried.add(Objects.requireNonNull(weapon, "weapon"));
            return this;
        }

        public Builder in(RoomId room) {
            this.room = Objects.requireNonNull(room, "room");
            return this;
        }

        public Builder currentHealth(int value) {
            this.currentHealth = value;
            return this;
        }

        public Builder experienceReward(int value) {
            if (value < 0) {
                throw new IllegalArgumentException("experienceReward must be >= 0");
            }
            this.experienceReward = value;
            return this;
        }

        public Builder experience(long value) {
            if (value < 0) {
                throw new IllegalArgumentException("experience must be >= 0");
            }
            this.experience = value;
            return this;
        }

        public Entity build() {
            Objects.requireNonNull(room, "room");
            return new Entity(this);
        }
    }
}
