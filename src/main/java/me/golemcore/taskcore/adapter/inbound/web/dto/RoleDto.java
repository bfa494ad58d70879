package me.golemcore.taskcore.adapter.inbound.web.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Role as exposed over the API. {@code capabilities} is {@code null} for an
 * unrestricted role.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RoleDto {

    private String name;
    private String displayName;
    private List<String> capabilities;
    private int maxReplyTokens;
}
