package com.missingtable.sync.model;

import jakarta.persistence.*;

@Entity
@Table(name = "age_groups", uniqueConstraints = {
        @UniqueConstraint(name = "uk_age_group_name", columnNames = {"name"})
})
public class AgeGroup {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 100)
    private String name; // e.g., "U14"

    public AgeGroup() {}

    public AgeGroup(String name) {
        this.name = name;
    }

    public Long getId() { return id; }
    public void setId(Long id) { this.id = id; }

    public String getName() { return name; }
    public void setName(String name) { this.name = name; }
}
