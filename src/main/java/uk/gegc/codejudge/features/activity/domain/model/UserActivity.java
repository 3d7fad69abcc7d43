package uk.gegc.codejudge.features.activity.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import uk.gegc.codejudge.features.user.domain.model.User;

import java.time.LocalDate;
import java.util.UUID;

@Entity
@Getter
@Setter
@Table(name = "user_activity",
        uniqueConstraints = @UniqueConstraint(name = "uk_activity_user_date", columnNames = {"user_id", "activity_date"}))
public class UserActivity {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @ManyToOne(optional = false, fetch = FetchType.LAZY)
    @JoinColumn(name = "user_id", nullable = false, updatable = false)
    private User user;

    @Column(name = "activity_date", nullable = false, updatable = false)
    private LocalDate activityDate;

    @Column(name = "submissions_count", nullable = false)
    private int submissionsCount;

    @Column(name = "problems_solved", nullable = false)
    private int problemsSolved;
}
