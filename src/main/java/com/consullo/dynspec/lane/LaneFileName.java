package com.consullo.dynspec.lane;

import com.consullo.dynspec.ConfigurationException;
import java.nio.file.Path;
import org.apache.commons.lang3.Validate;

/**
 * Lane file naming convention: {@code <session>_<lane digit>.<extension>}.
 *
 * @param path file path
 * @param session part of the file name before the last underscore, shared by every lane of one capture
 * @param laneIndex lane digit
 * @since 1.0
 */
public record LaneFileName(Path path, String session, int laneIndex) {

  /**
   * Parses the file name of {@code path}.
   *
   * @param path lane file
   * @return parsed name
   * @throws ConfigurationException if the name does not end in {@code _<digit>.<extension>}
   */
  public static LaneFileName parse(final Path path) {
    Validate.notNull(path, "path must not be null");
    final Path fileName = path.getFileName();
    if (fileName == null) {
      throw wrongPattern(path);
    }
    final String name = fileName.toString();
    final int dot = name.lastIndexOf('.');
    if (dot <= 0 || dot == name.length() - 1) {
      throw wrongPattern(path);
    }
    final String stem = name.substring(0, dot);
    final int underscore = stem.lastIndexOf('_');
    if (underscore < 0 || stem.length() - underscore != 2 || !Character.isDigit(stem.charAt(underscore + 1))) {
      throw wrongPattern(path);
    }
    return new LaneFileName(path, stem.substring(0, underscore), Character.digit(stem.charAt(underscore + 1), 10));
  }

  private static ConfigurationException wrongPattern(final Path path) {
    return new ConfigurationException(
        "Wrong file name pattern for " + path + ", it should end with *_<lane>.<extension>.");
  }
}
