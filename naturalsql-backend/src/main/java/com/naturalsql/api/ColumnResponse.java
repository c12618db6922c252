package com.naturalsql.api;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ColumnResponse {
    private String column;
    private String type;
    private boolean nullable;
    private String keyRole;
}
