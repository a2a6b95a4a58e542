package com.truefi.backend.repositories;

import java.util.UUID;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import com.truefi.backend.entities.Account;

@Repository
public interface AccountRepository extends JpaRepository<Account, UUID> {
}
