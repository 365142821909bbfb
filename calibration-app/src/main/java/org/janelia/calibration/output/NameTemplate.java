package org.janelia.calibration.output;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

import org.janelia.calibration.combine.CombineConfig;
import org.janelia.calibration.group.FrameGroup;

/**
 * File and folder name pattern with percent tokens:
 *
 * <pre>
 *   %d  run start date (yyyyMMdd)
 *   %t  run start time (HHmm)
 *   %f  filter name
 *   %m  combination method
 *   %x  dimensions (WxH)
 *   %b  binning (XxY)
 *   %c  mean temperature (one decimal)
 *   %e  mean exposure (three decimals)
 *   %%  percent sign
 * </pre>
 *
 * Missing values are replaced with stable placeholders and path separators in substituted values become '_'.
 */
public class NameTemplate {

    public static final String NO_FILTER = "NoFilter";
    public static final String NO_TEMPERATURE = "NoTemp";
    public static final String NO_EXPOSURE = "NoExposure";

    private static final DateTimeFormatter DATE_FORMATTER = DateTimeFormatter.ofPattern("yyyyMMdd");
    private static final DateTimeFormatter TIME_FORMATTER = DateTimeFormatter.ofPattern("HHmm");
    private static final String TOKEN_CHARACTERS = "dtfmxbce%";

    private final String template;

    /**
     * @throws IllegalArgumentException
     *   if the template is empty or contains an unknown token.
     */
    public NameTemplate(final String template)
            throws IllegalArgumentException {

        if ((template == null) || template.trim().isEmpty()) {
            throw new IllegalArgumentException("name template must not be empty");
        }

        for (int i = 0; i < template.length(); i++) {
            if (template.charAt(i) == '%') {
                i++;
                if ((i == template.length()) || (TOKEN_CHARACTERS.indexOf(template.charAt(i)) < 0)) {
                    throw new IllegalArgumentException("name template '" + template +
                                                       "' contains an invalid token at position " + (i - 1) +
                                                       ", valid tokens are %d, %t, %f, %m, %x, %b, %c, %e, and %%");
                }
            }
        }

        this.template = template;
    }

    public String getTemplate() {
        return template;
    }

    /**
     * @param  group          group whose metadata supplies token values.
     * @param  combineConfig  algorithm used to combine the group.
     * @param  runStartTime   start time of the run that processes the group.
     *
     * @return template with every token replaced.
     */
    public String apply(final FrameGroup group,
                        final CombineConfig combineConfig,
                        final LocalDateTime runStartTime) {

        final String filterName = group.getMostCommonFilterName();

        final StringBuilder sb = new StringBuilder(template.length() + 32);

        for (int i = 0; i < template.length(); i++) {
            final char c = template.charAt(i);
            if (c != '%') {
                sb.append(c);
                continue;
            }

            i++;
            final char token = template.charAt(i);
            switch (token) {
                case 'd':
                    sb.append(DATE_FORMATTER.format(runStartTime));
                    break;
                case 't':
                    sb.append(TIME_FORMATTER.format(runStartTime));
                    break;
                case 'f':
                    sb.append(sanitize(filterName == null ? NO_FILTER : filterName));
                    break;
                case 'm':
                    sb.append(combineConfig.getMethod().getFileNameToken());
                    break;
                case 'x':
                    sb.append(group.getSizeKey().getDimensionString());
                    break;
                case 'b':
                    sb.append(group.getSizeKey().getBinningString());
                    break;
                case 'c':
                    sb.append(formatOptional(group.getMeanTemperature(), "%.1f", NO_TEMPERATURE));
                    break;
                case 'e':
                    sb.append(formatOptional(group.getMeanExposure(), "%.3f", NO_EXPOSURE));
                    break;
                default:
                    sb.append('%');
            }
        }

        return sb.toString();
    }

    /**
     * @return value with path separator characters replaced by '_'.
     */
    public static String sanitize(final String value) {
        return value.replace('/', '_').replace('\\', '_');
    }

    private static String formatOptional(final Double value,
                                         final String format,
                                         final String placeholder) {
        return value == null ? placeholder : String.format(Locale.ROOT, format, value);
    }

    @Override
    public String toString() {
        return template;
    }
}
