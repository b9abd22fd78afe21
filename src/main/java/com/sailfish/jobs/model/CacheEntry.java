package com.sailfish.jobs.model;

import jakarta.persistence.*;
import java.io.Serializable;
import java.time.LocalDateTime;
import java.util.Objects;

/**
 * A cached value. Entries past {@code expires} are never returned and stay in the table
 * until the cleanup job removes them.
 */
@Entity
@Table(name = "app_cache", indexes = {
    @Index(name = "idx_app_cache_expires", columnList = "expires")
})
public class CacheEntry implements Serializable {

    private static final long serialVersionUID = 1L;

    @Id
    @Column(length = 255)
    private String id;

    @Column(name = "`value`", nullable = false, length = 16777216)
    private byte[] payload; // JSON

    @Column(nullable = false)
    private LocalDateTime expires;

    public CacheEntry() {
    }

    public CacheEntry(String id, byte[] payload, LocalDateTime expires) {
        this.id = id;
        this.payload = payload;
        this.expires = expires;
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public byte[] getPayload() {
        return payload;
    }

    public void setPayload(byte[] payload) {
        this.payload = payload;
    }

    public LocalDateTime getExpires() {
        return expires;
    }

    public void setExpires(LocalDateTime expires) {
        this.expires = expires;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        CacheEntry that = (CacheEntry) o;
        return Objects.equals(id, that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "CacheEntry{" +
               "id='" + id + '\'' +
               ", size=" + (payload == null ? 0 : payload.length) +
               ", expires=" + expires +
               '}';
    }
}
