package com.khoipd8.teacherdashboard.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@JsonIgnoreProperties(ignoreUnknown = true)
@Data
@NoArgsConstructor
@AllArgsConstructor
public class AuthRequestDto {

    @Schema(description = "Employee ID as listed in the Authentication sheet", example = "EMP001", requiredMode = Schema.RequiredMode.REQUIRED)
    private String employeeId;
}
