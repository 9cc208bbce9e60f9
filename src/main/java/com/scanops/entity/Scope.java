package com.scanops.entity;

import jakarta.persistence.*;
import lombok.*;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

@Entity
@Table(name = "scope")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Scope {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "name", length = 200, nullable = false)
    private String name;

    @Builder.Default
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "scope_cidr", joinColumns = @JoinColumn(name = "scope_id"))
    @Column(name = "cidr", length = 64)
    private List<String> cidrs = new ArrayList<>();

    @Builder.Default
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "scope_host", joinColumns = @JoinColumn(name = "scope_id"))
    @Column(name = "host_pattern", length = 255)
    private List<String> hosts = new ArrayList<>();

    @Column(name = "active", nullable = false)
    private boolean active;
}
