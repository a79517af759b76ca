package works.nuka.soclebot.models;

import jakarta.persistence.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.LocalDateTime;

/**
 * Entité représentant un paramètre clé/valeur propre à une guilde Discord
 */
@Entity
@Table(name = "guild_settings",
        uniqueConstraints = @UniqueConstraint(name = "uc_guild_setting_key", columnNames = {"guild_id", "setting_key"}),
        indexes = @Index(name = "idx_guild_settings_guild", columnList = "guild_id"))
public class GuildSetting {
    public static final int MAX_KEY_LENGTH = 100;
    public static final int MAX_VALUE_LENGTH = 500;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "guild_id", nullable = false)
    private long guildId;

    @Column(name = "setting_key", nullable = false, length = MAX_KEY_LENGTH)
    private String settingKey;

    @Column(name = "setting_value", length = MAX_VALUE_LENGTH)
    private String settingValue;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    // Constructeurs
    public GuildSetting() {
    }

    public GuildSetting(long guildId, String key, String value) {
        this.guildId = guildId;
        this.settingKey = key;
        this.settingValue = value;
    }

    // Getters et Setters
    public Long getId() {
        return id;
    }

    public long getGuildId() {
        return guildId;
    }

    public void setGuildId(long guildId) {
        this.guildId = guildId;
    }

    public String getSettingKey() {
        return settingKey;
    }

    public void setSettingKey(String settingKey) {
        this.settingKey = settingKey;
    }

    public String getSettingValue() {
        return settingValue;
    }

    public void setSettingValue(String settingValue) {
        this.settingValue = settingValue;
    }

    public LocalDateTime getCreatedAt() {
        return createdAt;
    }

    public LocalDateTime getUpdatedAt() {
        return updatedAt;
    }

    @Override
    public String toString() {
        return "GuildSetting{guildId=" + guildId + ", key='" + settingKey + "', value='" + settingValue + "'}";
    }
}
