package io.github.yok.snv.app;

import io.github.yok.snv.core.linearalgebra.EigenDecompositionBackend;
import io.github.yok.snv.core.linearalgebra.EjmlHermitianEigenDecompositionBackend;
import io.github.yok.snv.core.model.DefectModel;
import io.github.yok.snv.core.model.DipoleOperators;
import io.github.yok.snv.core.model.SnvDefectModel;
import io.github.yok.snv.core.parameter.MaterialParameters;
import io.github.yok.snv.core.service.OperatorDefaults;
import io.github.yok.snv.core.service.SpinCenterService;
import io.github.yok.snv.core.solver.FieldSweep;
import io.github.yok.snv.core.solver.ManifoldDiagonalizer;
import io.github.yok.snv.core.solver.SystemAssembler;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * SnV 中心モデル + EJML 固有分解 + 演算子組み立ての Bean 定義を行う設定クラスです。
 */
@Configuration
@RequiredArgsConstructor
public class SnvModelConfiguration {

    /**
     * snv-hamiltonian の設定値（snv.*）です。
     */
    private final SnvProperties p;

    /**
     * 物質パラメータを生成します。
     *
     * @return 物質パラメータです
     */
    @Bean
    public MaterialParameters materialParameters() {
        return p.getMaterial().toMaterialParameters();
    }

    /**
     * SnV 中心のハミルトニアンモデルを生成します。
     *
     * @param parameters 物質パラメータです
     * @return モデルです
     */
    @Bean
    public DefectModel defectModel(MaterialParameters parameters) {
        return new SnvDefectModel(parameters);
    }

    /**
     * 固有分解バックエンドを生成します。
     *
     * @return 固有分解バックエンドです
     */
    @Bean
    public EigenDecompositionBackend eigenDecompositionBackend() {
        return new EjmlHermitianEigenDecompositionBackend(
                p.getDiagnostics().getHermitianTolerance());
    }

    /**
     * 対角化と双極子変換を行うコンポーネントを生成します。
     *
     * @param eigen 固有分解バックエンドです
     * @return 対角化器です
     */
    @Bean
    public ManifoldDiagonalizer manifoldDiagonalizer(EigenDecompositionBackend eigen) {
        return new ManifoldDiagonalizer(eigen, DipoleOperators.raw());
    }

    /**
     * 系の組み立て器を生成します。
     *
     * @param model モデルです
     * @param diagonalizer 対角化器です
     * @return 組み立て器です
     */
    @Bean
    public SystemAssembler systemAssembler(DefectModel model, ManifoldDiagonalizer diagonalizer) {
        return new SystemAssembler(model, diagonalizer,
                p.getDiagnostics().getDegeneracyGapThreshold());
    }

    /**
     * 磁場スキャンを生成します。
     *
     * @param assembler 組み立て器です
     * @return 磁場スキャンです
     */
    @Bean
    public FieldSweep fieldSweep(SystemAssembler assembler) {
        return new FieldSweep(assembler);
    }

    /**
     * 公開演算の窓口を生成します。
     *
     * @param model モデルです
     * @param assembler 組み立て器です
     * @return 公開窓口です
     */
    @Bean
    public SpinCenterService spinCenterService(DefectModel model, SystemAssembler assembler) {
        SnvProperties.Defaults d = p.getDefaults();
        OperatorDefaults defaults = new OperatorDefaults(d.getFieldMagnitude(),
                SnvProperties.toVector("defaults.fieldDirection", d.getFieldDirection()));
        return new SpinCenterService(model, assembler, defaults);
    }
}
