package com.example.dbmonitor.repository;

import com.example.dbmonitor.domain.SuggestionSet;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface SuggestionSetRepository extends JpaRepository<SuggestionSet, String> {

    Optional<SuggestionSet> findByTargetId(String targetId);
}
