package com.example.org_membershipservice.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OrgTreeResponse {

    private List<OrgTreeNodeResponse> roots;
    private int maxDepth;
}
