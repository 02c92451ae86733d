package com.missingtable.sync.model;

import com.missingtable.sync.util.NameNormalizer;
import jakarta.persistence.*;

@Entity
@Table(name = "teams", uniqueConstraints = {
        @UniqueConstraint(name = "uk_team_normalized_name", columnNames = {"normalized_name"})
})
public class Team {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private String name;

    @Column(name = "normalized_name", nullable = false)
    private String normalizedName;

    public Team() {}

    public Team(String name) {
        this.name = name;
        this.normalizedName = NameNormalizer.normalize(name);
    }

    @PrePersist
    @PreUpdate
    private void prePersistUpdate() {
        if (this.name != null) {
            this.name = this.name.trim();
        }
        this.normalizedName = NameNormalizer.normalize(this.name);
    }

    public Long getId() { return id; }
    public void setId(Long id) { this.id = id; }

    public String getName() { return name; }
    public void setName(String name) { this.name = name; }

    public String getNormalizedName() { return normalizedName; }
    public void setNormalizedName(String normalizedName) { this.normalizedName = normalizedName; }
}
