package com.rally.leaguesync.repository;

import com.rally.leaguesync.model.ImportError;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface ImportErrorRepository extends JpaRepository<ImportError, Long> {
    List<ImportError> findByImportRunId(Long importRunId);
}
