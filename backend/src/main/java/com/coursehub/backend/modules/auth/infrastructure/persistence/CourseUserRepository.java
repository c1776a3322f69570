package com.coursehub.backend.modules.auth.infrastructure.persistence;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

import jakarta.persistence.LockModeType;

import com.coursehub.backend.modules.auth.domain.CourseUser;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface CourseUserRepository extends JpaRepository<CourseUser, Long> {

    Optional<CourseUser> findByUsername(String username);

    Optional<CourseUser> findByEmail(String email);

    Optional<CourseUser> findByResetToken(String resetToken);

    /**
     * Row-locks the token owner so concurrent resets with the same token apply at most once.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select cu from CourseUser cu where cu.resetToken = :token")
    Optional<CourseUser> findByResetTokenForUpdate(@Param("token") String token);

    boolean existsByUsername(String username);

    boolean existsByEmail(String email);

    /**
     * Usernames match exactly; emails are stored lowercased and matched against the lowercased input.
     */
    @Query("""
            select cu
              from CourseUser cu
             where cu.username = :identifier
                or cu.email = :lowercasedIdentifier
             order by case when cu.username = :identifier then 0 else 1 end
            """)
    List<CourseUser> findCandidatesByUsernameOrEmail(
            @Param("identifier") String identifier,
            @Param("lowercasedIdentifier") String lowercasedIdentifier
    );

    default Optional<CourseUser> findByUsernameOrEmail(String identifier) {
        if (identifier == null || identifier.isEmpty()) {
            return Optional.empty();
        }
        return findCandidatesByUsernameOrEmail(identifier, identifier.toLowerCase(Locale.ROOT))
                .stream()
                .findFirst();
    }
}
