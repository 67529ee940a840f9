package com.tsc.service;

import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.pdmodel.font.PDFont;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.apache.pdfbox.pdmodel.graphics.image.LosslessFactory;
import org.apache.pdfbox.pdmodel.graphics.image.PDImageXObject;
import org.springframework.stereotype.Component;

import com.google.zxing.BarcodeFormat;
import com.google.zxing.EncodeHintType;
import com.google.zxing.WriterException;
import com.google.zxing.common.BitMatrix;
import com.google.zxing.qrcode.QRCodeWriter;
import com.tsc.config.RegistrationProperties;
import com.tsc.entity.Registration;
import com.tsc.entity.Workshop;
import com.tsc.payment.entity.Payment;

@Component
public class PdfReceiptRenderer implements ReceiptRenderer {

    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");
    private static final float MARGIN = 60;
    private static final float LABEL_WIDTH = 150;
    private static final float QR_SIZE = 86;
    private static final int QR_PIXELS = 200;
    private static final int BLACK = 0x000000;
    private static final int WHITE = 0xFFFFFF;

    private final RegistrationProperties registrationProperties;
    private final Clock clock;

    public PdfReceiptRenderer(RegistrationProperties registrationProperties, Clock clock) {
        this.registrationProperties = registrationProperties;
        this.clock = clock;
    }

    @Override
    public byte[] renderReceipt(Registration registration, Payment payment) {
        Workshop workshop = registration.getWorkshop();

        try (PDDocument document = new PDDocument(); ByteArrayOutputStream out = new ByteArrayOutputStream()) {
            PDPage page = new PDPage(PDRectangle.A4);
            document.addPage(page);

            try (PDPageContentStream stream = new PDPageContentStream(document, page)) {
                float y = page.getMediaBox().getHeight() - MARGIN;

                y = centered(stream, page, registrationProperties.getOrganizationName(), PDType1Font.HELVETICA_BOLD, 18, y);
                y = centered(stream, page, "Workshop Registration Receipt", PDType1Font.HELVETICA_BOLD, 14, y - 6);
                y = centered(stream, page, "Registration No: " + registration.getRegistrationNumber(),
                        PDType1Font.HELVETICA_BOLD, 12, y - 14);

                y = section(stream, "Workshop Details", rows(
                        "Workshop Name:", workshop.getName(),
                        "Date:", workshop.getWorkshopDate(),
                        "Time:", workshop.getTime(),
                        "Duration:", workshop.getDuration(),
                        "Venue:", workshop.getVenue(),
                        "Organizer:", workshop.getOrganizer() != null && !workshop.getOrganizer().isBlank()
                                ? workshop.getOrganizer() : registrationProperties.getOrganizationName()), y - 20);

                y = section(stream, "Student Information", rows(
                        "Student Name:", registration.getStudentName(),
                        "Grade:", String.valueOf(registration.getGrade()),
                        "School:", registration.getSchoolDisplayName(),
                        "Contact Number:", registration.getContactNumber(),
                        "Email:", registration.getEmail()), y - 10);

                List<String[]> paymentRows = rows(
                        "Workshop Fee:", workshop.isFree() ? "BDT 0.00" : "BDT " + workshop.getFee().toPlainString(),
                        "Payment Status:", workshop.isFree() ? "FREE WORKSHOP" : registration.getPaymentStatus().getDisplayName(),
                        "Registration Date:", registration.getRegisteredAt() != null
                                ? registration.getRegisteredAt().format(TIMESTAMP) : "");
                if (payment != null) {
                    paymentRows.add(new String[] {"Transaction ID:", payment.getTransactionId()});
                    if (payment.getCompletedAt() != null) {
                        paymentRows.add(new String[] {"Payment Date:", payment.getCompletedAt().format(TIMESTAMP)});
                    }
                }
                y = section(stream, "Payment Information", paymentRows, y - 10);

                PDImageXObject qrImage = LosslessFactory.createFromImage(document,
                        qrCode("REG:" + registration.getRegistrationNumber()));
                y -= 14 + QR_SIZE;
                stream.drawImage(qrImage, (page.getMediaBox().getWidth() - QR_SIZE) / 2, y, QR_SIZE, QR_SIZE);

                y -= 20;
                y = centered(stream, page, "This is a computer-generated receipt and does not require a signature.",
                        PDType1Font.HELVETICA, 8, y);
                centered(stream, page, "Generated on: " + LocalDateTime.now(clock).format(TIMESTAMP),
                        PDType1Font.HELVETICA, 8, y - 2);
            }

            document.save(out);
            return out.toByteArray();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to render receipt for " + registration.getRegistrationNumber(), e);
        }
    }

    private static BufferedImage qrCode(String content) {
        Map<EncodeHintType, Object> hints = new EnumMap<>(EncodeHintType.class);
        hints.put(EncodeHintType.MARGIN, 2);
        BitMatrix matrix;
        try {
            matrix = new QRCodeWriter().encode(content, BarcodeFormat.QR_CODE, QR_PIXELS, QR_PIXELS, hints);
        } catch (WriterException e) {
            throw new IllegalStateException("Failed to encode QR code for " + content, e);
        }
        BufferedImage image = new BufferedImage(matrix.getWidth(), matrix.getHeight(), BufferedImage.TYPE_INT_RGB);
        for (int x = 0; x < matrix.getWidth(); x++) {
            for (int y = 0; y < matrix.getHeight(); y++) {
                image.setRGB(x, y, matrix.get(x, y) ? BLACK : WHITE);
            }
        }
        return image;
    }

    private static List<String[]> rows(String... labelsAndValues) {
        List<String[]> rows = new ArrayList<>();
        for (int i = 0; i + 1 < labelsAndValues.length; i += 2) {
            rows.add(new String[] {labelsAndValues[i], labelsAndValues[i + 1]});
        }
        return rows;
    }

    private float section(PDPageContentStream stream, String heading, List<String[]> rows, float y) throws IOException {
        y = text(stream, heading, PDType1Font.HELVETICA_BOLD, 13, MARGIN, y);
        for (String[] row : rows) {
            text(stream, row[0], PDType1Font.HELVETICA_BOLD, 10, MARGIN, y - 4);
            y = text(stream, row[1], PDType1Font.HELVETICA, 10, MARGIN + LABEL_WIDTH, y - 4);
        }
        return y;
    }

    private float centered(PDPageContentStream stream, PDPage page, String value, PDFont font, float size, float y)
            throws IOException {
        String safe = printable(value);
        float width = font.getStringWidth(safe) / 1000 * size;
        float x = (page.getMediaBox().getWidth() - width) / 2;
        return text(stream, safe, font, size, x, y);
    }

    // Returns the baseline for the next line
    private float text(PDPageContentStream stream, String value, PDFont font, float size, float x, float y)
            throws IOException {
        float baseline = y - size;
        stream.beginText();
        stream.setFont(font, size);
        stream.newLineAtOffset(x, baseline);
        stream.showText(printable(value));
        stream.endText();
        return baseline - 4;
    }

    // Standard 14 fonts only cover WinAnsi
    private static String printable(String value) {
        if (value == null) {
            return "";
        }
        StringBuilder sb = new StringBuilder(value.length());
        for (char c : value.toCharArray()) {
            sb.append(c >= 0x20 && c < 0x7F || c >= 0xA0 && c <= 0xFF ? c : '?');
        }
        return sb.toString();
    }
}
