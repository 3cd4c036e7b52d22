package com.openforge.clarifier.domain;

import jakarta.persistence.*;
import lombok.*;

/**
 * Per-user quota counter. Created lazily by the rate limiter; the counter is
 * only ever changed through the atomic increment query in
 * {@link com.openforge.clarifier.repository.UsageProfileRepository}.
 */
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(
    name = "usage_profiles",
    uniqueConstraints = @UniqueConstraint(name = "uq_usage_profile_user", columnNames = "user_id")
)
public class UsageProfile extends BaseEntity {

    @Column(name = "user_id", nullable = false, length = 128)
    private String userId;

    @Builder.Default
    @Column(name = "usage_count", nullable = false)
    private Integer usageCount = 0;

    /** Stored as text so legacy values such as "premium" survive; read through {@link #effectiveTier()}. */
    @Builder.Default
    @Column(name = "tier", nullable = false, length = 16)
    private String tier = "free";

    public Tier effectiveTier() {
        return Tier.normalize(tier);
    }

    public static UsageProfile initial(String userId, Tier tier, int usageCount) {
        return UsageProfile.builder()
                .userId(userId)
                .tier(tier.value())
                .usageCount(usageCount)
                .build();
    }
}
