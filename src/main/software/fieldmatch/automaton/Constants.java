package software.fieldmatch.automaton;

final class Constants {

  private Constants() {
    throw new UnsupportedOperationException("You can't create instance of utility class.");
  }

  // Symbol fed to the automaton after the last byte of a value. It sits above the byte range so a value can
  // contain any of the 256 byte values without being mistaken for its own end.
  final static int VALUE_TERMINATOR = 256;

  // Number of distinct symbols a table must cover: bytes 0..255 plus the terminator.
  final static int ALPHABET_SIZE = VALUE_TERMINATOR + 1;

  // The number of symbols a wildcard may consume: every byte, never the terminator.
  final static int BYTE_CEILING = 256;

  final static byte QUOTE_BYTE = '"';

  final static String EXACT_MATCH = "exactly";
  final static String PREFIX_MATCH = "prefix";
  final static String SUFFIX_MATCH = "suffix";
  final static String WILDCARD = "wildcard";
  final static String SHELLSTYLE = "shellstyle";
}
