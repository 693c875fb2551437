/**
 * License: GPL
 *
 * This program is free software; you can redistribute it and/or
 * modify it under the terms of the GNU General Public License 2
 * as published by the Free Software Foundation.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with this program; if not, write to the Free Software
 * Foundation, Inc., 59 Temple Place - Suite 330, Boston, MA  02111-1307, USA.
 */
package org.rephoto.alignment.spec;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.rephoto.alignment.correspondence.Correspondence;
import org.rephoto.alignment.correspondence.CorrespondenceSnapshot;
import org.rephoto.alignment.correspondence.CorrespondenceStore;
import org.rephoto.alignment.correspondence.InvalidShapeException;
import org.rephoto.alignment.json.JsonUtils;
import org.rephoto.alignment.transform.TransformMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Persisted alignment session: the two image paths, every correspondence and the selected transform mode.
 *
 * <pre>
 *   {
 *     "imageAPath": "...", "imageBPath": "...",
 *     "points": [ {"id", "ax", "ay", "bx", "by"} ],
 *     "lines":  [ {"id", "ax0", "ay0", "ax1", "ay1", "bx0", "by0", "bx1", "by1"} ],
 *     "faces":  [ {"id", "cornersA": [ {"x", "y"} x 4 ], "cornersB": [ {"x", "y"} x 4 ]} ],
 *     "transformMode": "HOMOGRAPHY"
 *   }
 * </pre>
 *
 * Every field except {@code transformMode} is required (saved projects list empty correspondence arrays
 * as {@code []}); anything missing or malformed causes a {@link ProjectFormatException}.
 */
public class AlignmentProject {

    private final String imageAPath;
    private final String imageBPath;
    private final List<PointSpec> points;
    private final List<LineSpec> lines;
    private final List<FaceSpec> faces;
    private final TransformMode transformMode;

    // no-arg constructor needed for JSON deserialization
    @SuppressWarnings("unused")
    private AlignmentProject() {
        this(null, null, null, null, null, null);
    }

    public AlignmentProject(final String imageAPath,
                            final String imageBPath,
                            final List<PointSpec> points,
                            final List<LineSpec> lines,
                            final List<FaceSpec> faces,
                            final TransformMode transformMode) {
        this.imageAPath = imageAPath;
        this.imageBPath = imageBPath;
        this.points = points;
        this.lines = lines;
        this.faces = faces;
        this.transformMode = transformMode;
    }

    /**
     * @return project for the specified store snapshot with each kind listed in store order.
     */
    public static AlignmentProject fromSnapshot(final String imageAPath,
                                                final String imageBPath,
                                                final CorrespondenceSnapshot snapshot,
                                                final TransformMode transformMode) {
        final List<PointSpec> points = new ArrayList<>();
        final List<LineSpec> lines = new ArrayList<>();
        final List<FaceSpec> faces = new ArrayList<>();
        for (final Correspondence correspondence : snapshot.getCorrespondences()) {
            switch (correspondence.getKind()) {
                case POINT:
                    points.add(new PointSpec(correspondence));
                    break;
                case LINE:
                    lines.add(new LineSpec(correspondence));
                    break;
                case FACE:
                    faces.add(new FaceSpec(correspondence));
                    break;
            }
        }
        return new AlignmentProject(imageAPath, imageBPath, points, lines, faces, transformMode);
    }

    public static AlignmentProject fromStore(final String imageAPath,
                                             final String imageBPath,
                                             final CorrespondenceStore store,
                                             final TransformMode transformMode) {
        return fromSnapshot(imageAPath, imageBPath, store.snapshot(), transformMode);
    }

    public String getImageAPath() {
        return imageAPath;
    }

    public String getImageBPath() {
        return imageBPath;
    }

    /**
     * @return the persisted transform mode, or the specified default if none was persisted.
     */
    public TransformMode getTransformMode(final TransformMode defaultMode) {
        return transformMode == null ? defaultMode : transformMode;
    }

    public int getCorrespondenceCount() {
        return size(points) + size(lines) + size(faces);
    }

    /**
     * Validates this project.
     *
     * @throws ProjectFormatException
     *   if any field is missing or malformed.
     */
    public void validate()
            throws ProjectFormatException {
        if ((imageAPath == null) || imageAPath.trim().isEmpty()) {
            throw new ProjectFormatException("project is missing imageAPath");
        }
        if ((imageBPath == null) || imageBPath.trim().isEmpty()) {
            throw new ProjectFormatException("project is missing imageBPath");
        }
        getCorrespondences();
    }

    /**
     * @return every persisted correspondence in ascending id order (the order they were originally added).
     *
     * @throws ProjectFormatException
     *   if any correspondence is malformed or if ids are duplicated.
     */
    public List<Correspondence> getCorrespondences()
            throws ProjectFormatException {

        final List<Correspondence> correspondences = new ArrayList<>(getCorrespondenceCount());
        try {
            for (final PointSpec spec : nonNull(points, "points")) {
                correspondences.add(spec.toCorrespondence());
            }
            for (final LineSpec spec : nonNull(lines, "lines")) {
                correspondences.add(spec.toCorrespondence());
            }
            for (final FaceSpec spec : nonNull(faces, "faces")) {
                correspondences.add(spec.toCorrespondence());
            }
        } catch (final InvalidShapeException e) {
            throw new ProjectFormatException("project contains an invalid correspondence: " + e.getMessage(), e);
        }

        final Set<Long> ids = new HashSet<>();
        for (final Correspondence correspondence : correspondences) {
            if (! ids.add(correspondence.getId())) {
                throw new ProjectFormatException("project contains duplicate correspondence id " +
                                                 correspondence.getId());
            }
        }

        correspondences.sort(Comparator.comparingLong(Correspondence::getId));

        return correspondences;
    }

    /**
     * Replaces the content of the specified store with this project's correspondences.
     * The store is left untouched if anything is invalid.
     *
     * @throws ProjectFormatException
     *   if any field is missing or malformed.
     */
    public void loadInto(final CorrespondenceStore store)
            throws ProjectFormatException {
        validate();
        try {
            store.replaceAll(getCorrespondences());
        } catch (final InvalidShapeException e) {
            throw new ProjectFormatException("failed to load correspondences: " + e.getMessage(), e);
        }
    }

    /**
     * @return the path of the specified image relative to the specified project file's directory
     *         (or the image path itself if it is absolute).
     */
    public static Path resolveImagePath(final Path projectFile,
                                        final String imagePath) {
        final Path parent = projectFile.toAbsolutePath().getParent();
        return parent == null ? Path.of(imagePath) : parent.resolve(imagePath);
    }

    public String toJson() {
        return JSON_HELPER.toJson(this);
    }

    /**
     * @throws ProjectFormatException
     *   if the json cannot be parsed or any field is missing or malformed.
     */
    public static AlignmentProject fromJson(final String json)
            throws ProjectFormatException {
        final AlignmentProject project;
        try {
            project = JSON_HELPER.fromJson(json);
        } catch (final IllegalArgumentException e) {
            throw new ProjectFormatException("failed to parse project: " + getRootMessage(e), e);
        }
        return validated(project);
    }

    /**
     * @throws ProjectFormatException
     *   if the json cannot be parsed or any field is missing or malformed.
     */
    public static AlignmentProject fromJson(final Reader json)
            throws ProjectFormatException {
        final AlignmentProject project;
        try {
            project = JSON_HELPER.fromJson(json);
        } catch (final IllegalArgumentException e) {
            throw new ProjectFormatException("failed to parse project: " + getRootMessage(e), e);
        }
        return validated(project);
    }

    /**
     * @throws IOException
     *   if the file cannot be read.
     *
     * @throws ProjectFormatException
     *   if the file content is not a valid project.
     */
    public static AlignmentProject load(final Path path)
            throws IOException, ProjectFormatException {

        LOG.info("load: entry, path={}", path);

        final String json = new String(Files.readAllBytes(path), StandardCharsets.UTF_8);
        final AlignmentProject project = fromJson(json);

        LOG.info("load: exit, loaded {} correspondences", project.getCorrespondenceCount());

        return project;
    }

    /**
     * @throws IOException
     *   if the file cannot be written.
     */
    public void save(final Path path)
            throws IOException {

        final Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }

        try (final Writer writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
            writer.write(toJson());
        }

        LOG.info("save: saved {} correspondences to {}", getCorrespondenceCount(), path);
    }

    @Override
    public String toString() {
        return "{imageAPath: '" + imageAPath + "', imageBPath: '" + imageBPath +
               "', correspondenceCount: " + getCorrespondenceCount() + ", transformMode: " + transformMode + '}';
    }

    private static AlignmentProject validated(final AlignmentProject project)
            throws ProjectFormatException {
        if (project == null) {
            throw new ProjectFormatException("project is empty");
        }
        project.validate();
        return project;
    }

    private static <T> List<T> nonNull(final List<T> list,
                                       final String name)
            throws ProjectFormatException {
        if (list == null) {
            throw new ProjectFormatException("project is missing the " + name + " array");
        }
        for (final T element : list) {
            if (element == null) {
                throw new ProjectFormatException(name + " contains a null element");
            }
        }
        return list;
    }

    private static int size(final List<?> list) {
        return list == null ? 0 : list.size();
    }

    private static String getRootMessage(final Throwable t) {
        Throwable cause = t;
        while (cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause.getMessage();
    }

    private static final JsonUtils.Helper<AlignmentProject> JSON_HELPER =
            new JsonUtils.Helper<>(AlignmentProject.class);

    private static final Logger LOG = LoggerFactory.getLogger(AlignmentProject.class);
}
