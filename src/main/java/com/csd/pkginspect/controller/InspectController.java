package com.csd.pkginspect.controller;

import com.csd.pkginspect.model.ComparisonResult;
import com.csd.pkginspect.model.RuntimeVersion;
import com.csd.pkginspect.model.UpdateCheckResult;
import com.csd.pkginspect.service.InspectionService;
import com.csd.pkginspect.service.SnapshotService;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api")
public class InspectController {

    private final InspectionService inspectionService;
    private final SnapshotService snapshotService;

    public InspectController(InspectionService inspectionService, SnapshotService snapshotService) {
        this.inspectionService = inspectionService;
        this.snapshotService = snapshotService;
    }

    @GetMapping("/runtimes")
    public List<RuntimeVersion> runtimes() {
        return inspectionService.listRuntimes();
    }

    @GetMapping("/runtimes/{runtime}/packages")
    public Map<String, String> packages(@PathVariable String runtime) {
        return inspectionService.listPackages(runtime);
    }

    @GetMapping("/inspect")
    public Object inspect(@RequestParam("package") String packageName,
                          @RequestParam String runtime,
                          @RequestParam(defaultValue = "") String field) {
        return inspectionService.inspect(packageName, runtime, field);
    }

    @GetMapping("/compare")
    public ComparisonResult compare(@RequestParam("package") String packageName,
                                    @RequestParam String runtimeA,
                                    @RequestParam String runtimeB,
                                    @RequestParam String field,
                                    @RequestParam(required = false) String op) {
        return inspectionService.compareAcrossRuntimes(packageName, runtimeA, runtimeB, field, op);
    }

    @GetMapping("/updates")
    public UpdateCheckResult updates(@RequestParam("package") String packageName,
                                     @RequestParam(required = false) String current) {
        return inspectionService.listUpdates(packageName, current);
    }

    @GetMapping("/remote")
    public Object remote(@RequestParam("package") String packageName,
                         @RequestParam(required = false) String item,
                         @RequestParam(required = false) String manager) {
        return inspectionService.inspectRemote(packageName, item, manager);
    }

    @GetMapping("/snapshot")
    public Object snapshot(@RequestParam(defaultValue = "all") String option) {
        return snapshotService.snapshot(option);
    }
}
