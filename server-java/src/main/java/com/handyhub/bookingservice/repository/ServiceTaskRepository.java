package com.handyhub.bookingservice.repository;

import com.handyhub.bookingservice.model.ServiceTask;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface ServiceTaskRepository extends JpaRepository<ServiceTask, Long> {

    List<ServiceTask> findByTaskNameIn(Collection<String> taskNames);

    Optional<ServiceTask> findByTaskName(String taskName);
}
