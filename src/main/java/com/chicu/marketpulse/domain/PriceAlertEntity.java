package com.chicu.marketpulse.domain;

import com.chicu.marketpulse.common.enums.AlertKind;
import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

@Entity
@Table(
        name = "price_alert",
        indexes = {
                @Index(name = "ix_price_alert_active", columnList = "active"),
                @Index(name = "ix_price_alert_owner", columnList = "owner")
        }
)
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PriceAlertEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 64)
    private String owner;

    @Column(nullable = false, length = 16)
    private String symbol;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private AlertKind kind;

    @Column(nullable = false)
    private double threshold;

    @Column(nullable = false)
    private boolean active;

    @Column(nullable = false)
    private Instant createdAt;

    private Instant triggeredAt;
}
