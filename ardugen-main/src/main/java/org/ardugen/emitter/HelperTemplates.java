package org.ardugen.emitter;

/**
 * Source templates of the helper routines, one per helper key. Each template receives the
 * name issued for the routine, the names of the helpers it calls, and the line separator.
 * <p>
 * Lists are {@code double} arrays passed with their length; NaN entries stand for
 * values that are not numbers.
 */
final class HelperTemplates {

    private HelperTemplates() {}

    static String isPrime(String name, String lineSeparator) {
        return render("""
                bool {name}(double n) {
                  // Naive test: https://en.wikipedia.org/wiki/Primality_test#Naive_methods
                  if (n == 2 || n == 3) {
                    return true;
                  }
                  // NaN, anything up to 1, fractions and multiples of 2 or 3 are not prime.
                  if (isnan(n) || n <= 1 || fmod(n, 1) != 0 || fmod(n, 2) == 0 || fmod(n, 3) == 0) {
                    return false;
                  }
                  // Only divisors of the form 6k - 1 and 6k + 1 up to sqrt(n) remain.
                  for (long x = 6; x <= sqrt(n) + 1; x += 6) {
                    if (fmod(n, x - 1) == 0 || fmod(n, x + 1) == 0) {
                      return false;
                    }
                  }
                  return true;
                }""", lineSeparator, "{name}", name);
    }

    static String randomInt(String name, String lineSeparator) {
        return render("""
                int {name}(int lower, int upper) {
                  if (lower > upper) {
                    int temp = lower;
                    lower = upper;
                    upper = temp;
                  }
                  return lower + (rand() % (upper - lower + 1));
                }""", lineSeparator, "{name}", name);
    }

    static String sum(String name, String lineSeparator) {
        return render("""
                double {name}(double myList[], int size) {
                  double sumVal = 0;
                  for (int i = 0; i < size; i++) {
                    sumVal += myList[i];
                  }
                  return sumVal;
                }""", lineSeparator, "{name}", name);
    }

    static String min(String name, String lineSeparator) {
        return render("""
                double {name}(double myList[], int size) {
                  if (size == 0) {
                    return NAN;
                  }
                  double minVal = myList[0];
                  for (int i = 1; i < size; i++) {
                    if (myList[i] < minVal) {
                      minVal = myList[i];
                    }
                  }
                  return minVal;
                }""", lineSeparator, "{name}", name);
    }

    static String max(String name, String lineSeparator) {
        return render("""
                double {name}(double myList[], int size) {
                  if (size == 0) {
                    return NAN;
                  }
                  double maxVal = myList[0];
                  for (int i = 1; i < size; i++) {
                    if (myList[i] > maxVal) {
                      maxVal = myList[i];
                    }
                  }
                  return maxVal;
                }""", lineSeparator, "{name}", name);
    }

    static String average(String name, String lineSeparator) {
        return render("""
                double {name}(double myList[], int size) {
                  // Entries that are not numbers are skipped.
                  double sumVal = 0;
                  int count = 0;
                  for (int i = 0; i < size; i++) {
                    if (!isnan(myList[i])) {
                      sumVal += myList[i];
                      count++;
                    }
                  }
                  if (count == 0) {
                    return NAN;
                  }
                  return sumVal / count;
                }""", lineSeparator, "{name}", name);
    }

    static String nthSmallest(String name, String lineSeparator) {
        return render("""
                double {name}(double myList[], int size, int n) {
                  // The n-th smallest number in myList, counting from 0. Entries that are
                  // not numbers are skipped and myList is left as it is.
                  for (int i = 0; i < size; i++) {
                    if (isnan(myList[i])) {
                      continue;
                    }
                    int below = 0;
                    int same = 0;
                    for (int j = 0; j < size; j++) {
                      if (myList[j] < myList[i]) {
                        below++;
                      } else if (myList[j] == myList[i]) {
                        same++;
                      }
                    }
                    if (below <= n && n < below + same) {
                      return myList[i];
                    }
                  }
                  return NAN;
                }""", lineSeparator, "{name}", name);
    }

    static String median(String name, String nthSmallest, String lineSeparator) {
        return render("""
                double {name}(double myList[], int size) {
                  int count = 0;
                  for (int i = 0; i < size; i++) {
                    if (!isnan(myList[i])) {
                      count++;
                    }
                  }
                  if (count == 0) {
                    return NAN;
                  }
                  int index = count / 2;
                  if (count % 2 == 1) {
                    return {nth}(myList, size, index);
                  }
                  return ({nth}(myList, size, index - 1) + {nth}(myList, size, index)) / 2;
                }""", lineSeparator, "{name}", name, "{nth}", nthSmallest);
    }

    static String mode(String name, String lineSeparator) {
        return render("""
                double {name}(double myList[], int size) {
                  // The most frequent number in myList, the smallest of them on a tie.
                  double mode = NAN;
                  int maxCount = 0;
                  for (int i = 0; i < size; i++) {
                    if (isnan(myList[i])) {
                      continue;
                    }
                    int count = 0;
                    for (int j = 0; j < size; j++) {
                      if (myList[j] == myList[i]) {
                        count++;
                      }
                    }
                    if (count > maxCount || (count == maxCount && myList[i] < mode)) {
                      maxCount = count;
                      mode = myList[i];
                    }
                  }
                  return mode;
                }""", lineSeparator, "{name}", name);
    }

    static String standardDeviation(String name, String lineSeparator) {
        return render("""
                double {name}(double myList[], int size) {
                  // Population standard deviation of the numbers in myList.
                  double sum = 0;
                  int count = 0;
                  for (int i = 0; i < size; i++) {
                    if (!isnan(myList[i])) {
                      sum += myList[i];
                      count++;
                    }
                  }
                  if (count == 0) {
                    return NAN;
                  }
                  double mean = sum / count;
                  double sumSquare = 0;
                  for (int i = 0; i < size; i++) {
                    if (!isnan(myList[i])) {
                      sumSquare += pow(myList[i] - mean, 2);
                    }
                  }
                  return sqrt(sumSquare / count);
                }""", lineSeparator, "{name}", name);
    }

    static String randomItem(String name, String lineSeparator) {
        return render("""
                double {name}(double myList[], int size) {
                  if (size == 0) {
                    return NAN;
                  }
                  return myList[rand() % size];
                }""", lineSeparator, "{name}", name);
    }

    private static String render(String template, String lineSeparator, String... replacements) {
        String source = template;
        for (int i = 0; i < replacements.length; i += 2) {
            source = source.replace(replacements[i], replacements[i + 1]);
        }
        return "\n".equals(lineSeparator) ? source : source.replace("\n", lineSeparator);
    }
}
