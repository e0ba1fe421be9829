package com.family.library.repository;

import com.family.library.entity.Participant;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface ParticipantRepository extends JpaRepository<Participant, String> {

    List<Participant> findAllByOrderByNameAsc();

    Optional<Participant> findByName(String name);
}
