package com.openforge.posgate.staff.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.openforge.posgate.auth.dto.UserSummary;

/** {@code temporaryPassword} is present only when the server generated it. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record StaffCreatedResponse(StaffResponse staff, UserSummary user, String temporaryPassword) {}
