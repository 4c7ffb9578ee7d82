package com.ospicorp.rentindex.dataset;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.springframework.stereotype.Component;

@Component
public class LocalDatasetStore implements DatasetStore {

  @Override
  public List<String> listFiles(String location) throws IOException {
    Path root = Paths.get(location);
    if (Files.isRegularFile(root)) {
      return List.of(root.toString());
    }
    if (!Files.isDirectory(root)) {
      throw new IOException("No such file or directory: " + location);
    }
    try (Stream<Path> walk = Files.walk(root)) {
      return walk.filter(Files::isRegularFile)
          .map(Path::toString)
          .sorted()
          .collect(Collectors.toList());
    }
  }

  @Override
  public Reader openReader(String path) throws IOException {
    return Files.newBufferedReader(Paths.get(path), StandardCharsets.UTF_8);
  }

  @Override
  public Writer openWriter(String path) throws IOException {
    Path target = Paths.get(path);
    Path parent = target.getParent();
    if (parent != null) {
      Files.createDirectories(parent);
    }
    return Files.newBufferedWriter(target, StandardCharsets.UTF_8);
  }

  @Override
  public boolean exists(String path) {
    return Files.exists(Paths.get(path));
  }

  @Override
  public String resolve(String base, String... segments) {
    Path path = Paths.get(base);
    for (String segment : segments) {
      path = path.resolve(segment);
    }
    return path.toString();
  }

  @Override
  public String relativize(String base, String path) {
    Path root = Paths.get(base);
    if (Files.isRegularFile(root)) {
      return Paths.get(path).getFileName().toString();
    }
    return root.relativize(Paths.get(path)).toString().replace('\\', '/');
  }
}
