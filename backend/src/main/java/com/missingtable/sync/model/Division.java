package com.missingtable.sync.model;

import jakarta.persistence.*;

@Entity
@Table(name = "divisions", uniqueConstraints = {
        @UniqueConstraint(name = "uk_division_name", columnNames = {"name"})
})
public class Division {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 100)
    private String name; // e.g., "Northeast"

    public Division() {}

    public Division(String name) {
        this.name = name;
    }

    public Long getId() { return id; }
    public void setId(Long id) { this.id = id; }

    public String getName() { return name; }
    public void setName(String name) { this.name = name; }
}
