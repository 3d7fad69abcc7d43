package uk.gegc.codejudge.features.user.domain.model;

import jakarta.persistence.*;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import uk.gegc.codejudge.features.problem.domain.model.Difficulty;

import java.time.Instant;
import java.util.UUID;

@Entity
@Getter
@Setter
@NoArgsConstructor
@Table(name = "users")
public class User {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "user_id", updatable = false, nullable = false)
    private UUID id;

    @NotBlank
    @Size(min = 3, max = 150)
    @Column(name = "username", unique = true, nullable = false, length = 150)
    private String username;

    @NotBlank
    @Email
    @Column(name = "email", nullable = false)
    private String email;

    @Column(name = "password", nullable = false)
    private String hashedPassword;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "is_active", nullable = false)
    private boolean active = true;

    @Column(name = "is_banned", nullable = false)
    private boolean banned;

    // Aggregates maintained by the statistics updater while holding this row's lock
    @Column(name = "total_solved", nullable = false)
    private int totalSolved;

    @Column(name = "easy_solved", nullable = false)
    private int easySolved;

    @Column(name = "medium_solved", nullable = false)
    private int mediumSolved;

    @Column(name = "hard_solved", nullable = false)
    private int hardSolved;

    @PrePersist
    void prePersist() {
        if (this.createdAt == null) {
            this.createdAt = Instant.now();
        }
    }

    public void recordFirstSolve(Difficulty difficulty) {
        this.totalSolved++;
        switch (difficulty) {
            case EASY -> this.easySolved++;
            case MEDIUM -> this.mediumSolved++;
            case HARD -> this.hardSolved++;
        }
    }
}
