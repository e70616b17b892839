package com.automate.CodeAudit.Controller;

import com.automate.CodeAudit.Service.AccessService;
import com.automate.CodeAudit.Service.AnalysisService;
import com.automate.CodeAudit.Service.ProjectService;
import com.automate.CodeAudit.dto.request.FindingsImportRequest;
import com.automate.CodeAudit.dto.response.AnalysisResponse;
import com.automate.CodeAudit.dto.response.ProjectDetailResponse;
import com.automate.CodeAudit.dto.response.ProjectResponse;
import com.automate.CodeAudit.entity.UsersEntity;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.security.Principal;
import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/projects")
public class ProjectController {

    private final ProjectService projectService;
    private final AnalysisService analysisService;
    private final AccessService accessService;

    public ProjectController(ProjectService projectService,
                             AnalysisService analysisService,
                             AccessService accessService) {
        this.projectService = projectService;
        this.analysisService = analysisService;
        this.accessService = accessService;
    }

    @PostMapping(consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<ProjectResponse> createProject(@RequestParam("name") String name,
                                                         @RequestParam("archive") MultipartFile archive,
                                                         Principal principal,
                                                         UriComponentsBuilder uriBuilder) {
        UsersEntity user = accessService.currentUser(principal.getName());
        ProjectResponse created = projectService.createProject(name, archive, user);

        URI location = uriBuilder
                .path("/api/projects/{id}")
                .buildAndExpand(created.projectId())
                .toUri();

        return ResponseEntity.created(location).body(created);
    }

    @GetMapping
    public List<ProjectResponse> listProjects(Principal principal) {
        return projectService.listProjects(accessService.currentUser(principal.getName()));
    }

    @GetMapping("/{projectId}")
    public ProjectDetailResponse getProject(@PathVariable UUID projectId, Principal principal) {
        return projectService.getProjectDetail(projectId, accessService.currentUser(principal.getName()));
    }

    @DeleteMapping("/{projectId}")
    public ResponseEntity<Void> deleteProject(@PathVariable UUID projectId, Principal principal) {
        projectService.getAccessibleProject(projectId, accessService.currentUser(principal.getName()));
        projectService.removeProject(projectId);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/{projectId}/analysis")
    public ResponseEntity<AnalysisResponse> startAnalysis(@PathVariable UUID projectId, Principal principal) {
        projectService.getAccessibleProject(projectId, accessService.currentUser(principal.getName()));
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(analysisService.startAnalysis(projectId));
    }

    @GetMapping("/{projectId}/analysis")
    public AnalysisResponse getAnalysis(@PathVariable UUID projectId, Principal principal) {
        projectService.getAccessibleProject(projectId, accessService.currentUser(principal.getName()));
        return analysisService.getAnalysis(projectId);
    }

    @PutMapping("/{projectId}/findings")
    public AnalysisResponse importFindings(@PathVariable UUID projectId,
                                           @Valid @RequestBody FindingsImportRequest req,
                                           Principal principal) {
        projectService.getAccessibleProject(projectId, accessService.currentUser(principal.getName()));
        return analysisService.importFindings(projectId, req);
    }
}
