package com.example.timesheet.client;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Set;

@Repository
public interface ClientRepository extends JpaRepository<Client, Long> {

    boolean existsByName(String name);

    List<Client> findByActiveTrueOrderByNameAsc();

    @Query("select c.id from Client c where c.active = true")
    Set<Long> findActiveIds();
}
