package com.infrastructure.api.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.Setter;

@Setter
@Getter
@Entity
@Table(name = "companies")
public class Company {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(updatable = false, nullable = false)
    private Long id;

    @Column(name = "name", nullable = false)
    private String name;

    @Column(name = "province", nullable = false, length = 100)
    private String province;

    @Column(name = "city", nullable = false)
    private String city;

    @Column(name = "email", length = 100)
    private String email;

    @Column(name = "number", length = 100)
    private String number;

    public Company() {
    }
}
