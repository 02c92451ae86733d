package com.missingtable.sync.model;

import jakarta.persistence.*;

@Entity
@Table(name = "match_types", uniqueConstraints = {
        @UniqueConstraint(name = "uk_match_type_name", columnNames = {"name"})
})
public class MatchType {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 100)
    private String name; // e.g., "League"

    public MatchType() {}

    public MatchType(String name) {
        this.name = name;
    }

    public Long getId() { return id; }
    public void setId(Long id) { this.id = id; }

    public String getName() { return name; }
    public void setName(String name) { this.name = name; }
}
