package boxless.email.app.repository;

import boxless.email.app.entity.User;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface UserRepository extends JpaRepository<User, Long> {
    Optional<User> findByEmail(String email);

    // Users eligible for background sync, in id order so stagger offsets are stable.
    @Query("SELECT u FROM User u WHERE u.active = true AND u.token.accessToken IS NOT NULL ORDER BY u.id")
    List<User> findSyncableUsers();
}
