package com.openforge.posgate.repository;

import com.openforge.posgate.domain.AuditLog;
import org.hibernate.annotations.Immutable;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.data.repository.CrudRepository;
import org.springframework.data.repository.ListCrudRepository;

import java.lang.reflect.Method;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("AuditLogRepository")
class AuditLogRepositoryTest {

    private static List<String> methodNames() {
        return Arrays.stream(AuditLogRepository.class.getMethods())
                .map(Method::getName)
                .toList();
    }

    @Test
    @DisplayName("does not inherit the CRUD mutation API")
    void notCrud() {
        assertThat(CrudRepository.class.isAssignableFrom(AuditLogRepository.class)).isFalse();
        assertThat(ListCrudRepository.class.isAssignableFrom(AuditLogRepository.class)).isFalse();
    }

    @Test
    @DisplayName("exposes no delete or bulk-save method")
    void noDelete() {
        assertThat(methodNames())
                .noneMatch(name -> name.startsWith("delete"))
                .noneMatch(name -> name.startsWith("saveAll"))
                .noneMatch(name -> name.startsWith("saveAndFlush"));
    }

    @Test
    @DisplayName("save is the only write; everything else is a finder")
    void onlyInsertAndFind() {
        assertThat(methodNames())
                .contains("save")
                .allMatch(name -> name.equals("save") || name.startsWith("find"));
    }

    @Test
    @DisplayName("entity is immutable once inserted")
    void entityImmutable() {
        assertThat(AuditLog.class.isAnnotationPresent(Immutable.class)).isTrue();
    }
}
