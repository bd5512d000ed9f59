package com.handyhub.bookingservice.repository;

import com.handyhub.bookingservice.model.ServiceProvider;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface ServiceProviderRepository extends JpaRepository<ServiceProvider, String> {

    @Query("SELECT DISTINCT p FROM ServiceProvider p JOIN p.categories c " +
            "WHERE c = :category AND p.active = true ORDER BY p.providerId")
    List<ServiceProvider> findActiveByCategory(@Param("category") String category);

    /**
     * First write of a hold transaction. Takes the provider's row lock (the database write
     * lock on SQLite) so concurrent holds for the same provider run one after another.
     */
    @Modifying
    @Query("UPDATE ServiceProvider p SET p.scheduleVersion = p.scheduleVersion + 1 WHERE p.providerId = :providerId")
    int bumpScheduleVersion(@Param("providerId") String providerId);
}
