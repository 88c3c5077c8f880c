package com.workshopos.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;

@Embeddable
public class EnvEntry {

    @Column(name = "env_name", nullable = false)
    private String name;

    @Column(name = "env_value", columnDefinition = "TEXT")
    private String value;

    public EnvEntry() {}

    public EnvEntry(String name, String value) {
        this.name = name;
        this.value = value;
    }

    public String getName() { return name; }
    public void setName(String name) { this.name = name; }

    public String getValue() { return value; }
    public void setValue(String value) { this.value = value; }
}
