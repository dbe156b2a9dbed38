package com.eventharvester.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import javax.persistence.*;
import java.time.Instant;

/**
 * Entity representing a harvested event stored by the direct-store publisher.
 * 
 * Сущность, представляющая мероприятие, собранное с сайта площадки и сохраненное в базе данных.
 */
@Entity // Аннотация, указывающая, что этот класс является сущностью JPA
@Table(name = "events", // Указывает имя таблицы в базе данных
        uniqueConstraints = @UniqueConstraint(name = "unique_event",
                columnNames = {"title", "start_date_time", "city"}))
@Data // Lombok: автоматически генерирует геттеры, сеттеры, equals, hashCode и toString
@Builder // Lombok: позволяет использовать паттерн Builder для создания объектов
@NoArgsConstructor // Lombok: генерирует конструктор без аргументов
@AllArgsConstructor // Lombok: генерирует конструктор со всеми аргументами
public class Event {

    @Id // Первичный ключ
    @GeneratedValue(strategy = GenerationType.IDENTITY) // Автоинкремент ID
    private Long id;

    @Column(nullable = false, length = 500)
    private String title; // Название мероприятия

    @Column(columnDefinition = "TEXT")
    private String description;

    @Column
    private String category;

    @Column
    private String subcategory;

    @Column(nullable = false)
    private String city;

    @Column
    private String country;

    @Column(name = "start_date_time")
    private Instant startDateTime; // Может быть NULL: события без даты сохраняются для ручной проверки

    @Column(name = "custom_venue_name")
    private String venueName; // Название площадки, как указано в источнике

    @Column(name = "custom_venue_address")
    private String venueAddress;

    @Column(name = "venue_id")
    private Long venueId; // Ссылка на запись в реестре площадок, заполняется при связывании

    @Column(name = "price_info")
    private String priceInfo;

    @Column(name = "is_free", nullable = false)
    private boolean free;

    @Column(name = "website_url", length = 1000)
    private String websiteUrl;

    @Column(name = "booking_url", length = 1000)
    private String ticketUrl;

    @Column(name = "image_url", length = 1000)
    private String imageUrl;

    @Column(length = 1000)
    private String tags; // Исполнители через запятую

    @Column(nullable = false)
    private String source; // Идентификатор скрапера, например "flex-scraper"

    @Column(name = "source_url", length = 1000)
    private String sourceUrl; // URL источника, ключ для обновления существующей записи

    @Column(length = 200)
    private String slug;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @PrePersist // Вызывается перед сохранением новой сущности
    protected void onCreate() {
        createdAt = Instant.now();
    }

    @PreUpdate // Вызывается перед обновлением существующей сущности
    protected void onUpdate() {
        updatedAt = Instant.now();
    }
}
