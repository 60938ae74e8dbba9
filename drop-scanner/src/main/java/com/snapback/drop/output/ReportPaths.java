package com.snapback.drop.output;

import java.nio.file.Path;

public record ReportPaths(Path csv, Path json) {}
