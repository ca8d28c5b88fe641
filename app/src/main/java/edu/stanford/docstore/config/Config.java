package edu.stanford.docstore.config;

import com.google.common.base.Charsets;
import com.google.common.base.Preconditions;
import com.google.common.io.Files;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import java.io.File;
import java.io.IOException;
import java.io.UncheckedIOException;

/** Loads JSON configuration files. */
public class Config {
  private static final Gson gson = new GsonBuilder().create();

  public static <T> T loadConfig(File configFile, Class<T> clazz) {
    try (var reader = Files.newReader(configFile, Charsets.UTF_8)) {
      var config = gson.fromJson(reader, clazz);
      if (config == null) {
        throw new JsonParseException("Config file " + configFile + " is empty");
      }
      return config;
    } catch (IOException e) {
      throw new UncheckedIOException("Could not read config file " + configFile, e);
    }
  }

  /** Loads a file named relative to the directory holding {@code configFile}. */
  public static <T> T loadConfig(File configFile, String path, Class<T> clazz) {
    return loadConfig(resolveRelativeToConfigFile(configFile, path), clazz);
  }

  public static File resolveRelativeToConfigFile(File configFile, String path) {
    Preconditions.checkNotNull(path, "path");
    var parent = configFile.getAbsoluteFile().getParentFile();
    return parent.toPath().resolve(path).toFile();
  }

  public static ClientConfig loadClientConfig(File configFile) {
    var config = loadConfig(configFile, ClientConfig.class);
    Preconditions.checkArgument(
        config.getProject() != null && !config.getProject().isEmpty(),
        "Config file %s must set a project",
        configFile);
    return config;
  }
}
