package com.eventharvester.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import javax.persistence.*;
import java.util.Locale;

/**
 * Entry of the venue registry that events are linked to.
 * 
 * Площадка (клуб, бар, концертный зал) из реестра, с которой связываются мероприятия.
 */
@Entity
@Table(name = "venues",
        uniqueConstraints = @UniqueConstraint(name = "unique_venue_name_city", columnNames = {"name", "city"}))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Venue {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private String name;

    @Column(name = "normalized_name", nullable = false)
    private String normalizedName; // Производный ключ, пересчитывается при каждом сохранении

    @Column(nullable = false, length = 100)
    private String city;

    @Column(length = 100)
    private String country;

    @Column(columnDefinition = "TEXT")
    private String address;

    @Column
    private String website;

    @PrePersist
    @PreUpdate
    protected void deriveNormalizedName() {
        normalizedName = normalize(name);
    }

    /**
     * Lower-cases the name, collapses inner whitespace and trims it.
     *
     * @param name venue name as written anywhere, may be null
     * @return the matching key, empty for null input
     */
    public static String normalize(String name) {
        if (name == null) {
            return "";
        }
        return name.toLowerCase(Locale.ROOT).replaceAll("\\s+", " ").trim();
    }
}
